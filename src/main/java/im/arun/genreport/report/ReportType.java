package im.arun.genreport.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum ReportType {
    MAINEXPORT("mainexport", "persongalleri", "md"),
    JSON("json", "genreport", "json");

    private static final Logger logger = LoggerFactory.getLogger(ReportType.class);

    private final String name;
    private final String baseName;
    private final String extension;

    ReportType(String name, String baseName, String extension) {
        this.name = name;
        this.baseName = baseName;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    public String getBaseName() {
        return baseName;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Report by its command-line name. Unknown names fall back to {@link #MAINEXPORT}.
     */
    public static ReportType fromName(String value) {
        if (value != null) {
            String wanted = value.strip().toLowerCase(Locale.ROOT);
            for (ReportType type : values()) {
                if (type.name.equals(wanted)) {
                    return type;
                }
            }
        }
        logger.warn("Unknown report '{}', using '{}'", value, MAINEXPORT.name);
        return MAINEXPORT;
    }
}
