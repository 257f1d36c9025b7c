package im.arun.genreport.report;

import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.extract.IndividualExtractor;
import im.arun.genreport.model.Gender;
import im.arun.genreport.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Report labels for relations. Parents are told apart by the gender of the person whose
 * id ends the relation line.
 */
public class RelationLabeler {
    private static final Logger logger = LoggerFactory.getLogger(RelationLabeler.class);

    private static final Pattern TRAILING_ID = Pattern.compile(",\\s*(\\d+)\\s*$");

    private final IndividualExtractor extractor;
    private final GenReportConfig.Labels labels;

    public RelationLabeler(IndividualExtractor extractor, GenReportConfig.Labels labels) {
        this.extractor = extractor;
        this.labels = labels;
    }

    public String label(Relation relation) {
        switch (relation.getKind()) {
            case SPOUSE:
                return labels.getSpouse();
            case CHILD:
                return labels.getChild();
            case PARENT:
                return parentLabel(relation.getTargetLine());
            default:
                return relation.getDescription();
        }
    }

    private String parentLabel(String line) {
        Matcher m = TRAILING_ID.matcher(line == null ? "" : line);
        if (!m.find()) {
            logger.warn("Could not parse parent ID from line '{}'", line);
            return labels.getParent();
        }
        String id = m.group(1);
        Gender gender = extractor.genderOf(id);
        if (gender == Gender.MALE) {
            return labels.getFather();
        }
        if (gender == Gender.FEMALE) {
            return labels.getMother();
        }
        logger.warn("Unknown gender for parent ID {}", id);
        return labels.getParent();
    }
}
