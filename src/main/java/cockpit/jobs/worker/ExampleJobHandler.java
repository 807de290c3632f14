package cockpit.jobs.worker;

import cockpit.jobs.model.JobTypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Demonstration job: walks the target devices one by one, reporting
 * progress and honouring cancellation between devices.
 */
public class ExampleJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ExampleJobHandler.class);

    public static final JobTypeInfo INFO = new JobTypeInfo(
            "example",
            "Example",
            "Example job that processes each target device and echoes its parameters");

    private final Duration stepDelay;

    public ExampleJobHandler() {
        this(Duration.ZERO);
    }

    public ExampleJobHandler(Duration stepDelay) {
        this.stepDelay = stepDelay;
    }

    @Override
    public Map<String, Object> execute(JobContext context) throws InterruptedException {
        List<String> devices = context.targetDevices();
        List<String> processed = new ArrayList<>();
        int total = devices.size();

        log.info("Example job {} started for {} device(s)", context.runId(), total);

        for (int i = 0; i < total; i++) {
            context.checkpoint();
            String device = devices.get(i);
            if (!stepDelay.isZero()) {
                Thread.sleep(stepDelay.toMillis());
            }
            processed.add(device);
            context.putPartial("processed_devices", List.copyOf(processed));
            context.progress("Processed " + device, i + 1, total);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("message", "Example job completed for " + total + " device(s)");
        result.put("job_parameters", context.parameters());
        result.put("target_devices", devices);
        return result;
    }
}
