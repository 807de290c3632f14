package cockpit.jobs.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Instant binding for TIMESTAMP WITH TIME ZONE columns.
 * Values are always written at UTC so they never depend on the JVM zone.
 */
final class SqlTimes {

    private SqlTimes() {
    }

    static OffsetDateTime param(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    static void set(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, param(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }

    static Instant get(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
