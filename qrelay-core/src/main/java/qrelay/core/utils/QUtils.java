package qrelay.core.utils;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class QUtils {

    private static final TimeBasedEpochGenerator ID_GENERATOR = Generators.timeBasedEpochGenerator();

    private static final DateTimeFormatter DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private QUtils() {
    }

    // Time-ordered identifier with a short type prefix, e.g. "msg_0190..."
    public static String newId(String prefix) {
        return prefix + "_" + ID_GENERATOR.generate().toString().replace("-", "");
    }

    public static String millisToDateTime(long millis) {
        return DATE_TIME_FORMATTER.format(Instant.ofEpochMilli(millis));
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
