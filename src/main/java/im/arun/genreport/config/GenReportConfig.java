package im.arun.genreport.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run configuration, bound from {@code genreport.yaml}.
 */
@Data
public class GenReportConfig {
    private ExceptionBand exceptionBand = new ExceptionBand();
    private int islandPreviewLimit = 20;
    private Labels labels = new Labels();
    private Places places = new Places();
    private List<FieldRule> fieldRules = defaultFieldRules();

    /**
     * Individuals forced onto a fixed identifier range regardless of their position in the tree.
     */
    @Data
    public static class ExceptionBand {
        private List<String> xrefs = new ArrayList<>();
        private int start = 9001;
    }

    /**
     * Line labels of the Markdown report.
     */
    @Data
    public static class Labels {
        private String title = "Persongalleri";
        private String father = "Far:";
        private String mother = "Mor:";
        private String parent = "Förälder:";
        private String spouse = "Gift:";
        private String child = "Barn:";
        private String occupation = "Syssla:";
        private String birth = "Född:";
        private String death = "Död:";
        private String placePreposition = "i";
        private String note = "Not:";
    }

    /**
     * Abbreviations expanded by place cleaning.
     */
    @Data
    public static class Places {
        private Map<String, String> provinces = defaultProvinces();
        private Map<String, String> countries = defaultCountries();
    }

    /**
     * Excludes fields whose id equals {@code fieldId}; with {@code contains} set, only when the
     * content also contains that text (case-insensitive).
     */
    @Data
    public static class FieldRule {
        private String fieldId;
        private String contains;

        public FieldRule() {
        }

        public FieldRule(String fieldId, String contains) {
            this.fieldId = fieldId;
            this.contains = contains;
        }
    }

    private static List<FieldRule> defaultFieldRules() {
        List<FieldRule> rules = new ArrayList<>();
        rules.add(new FieldRule("SOUR.PAGE", "www.myheritage"));
        rules.add(new FieldRule("SOUR.ROLE", null));
        rules.add(new FieldRule("SOUR._LINK", "www.myheritage"));
        rules.add(new FieldRule("SOUR._UID", null));
        return rules;
    }

    private static Map<String, String> defaultProvinces() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("BL", "Blekinge");
        m.put("BO", "Bohuslän");
        m.put("DR", "Dalarna");
        m.put("DS", "Dalsland");
        m.put("GO", "Gotland");
        m.put("GÄ", "Gästrikland");
        m.put("HA", "Halland");
        m.put("HS", "Hälsingland");
        m.put("HR", "Härjedalen");
        m.put("JÄ", "Jämtland");
        m.put("LA", "Lappland");
        m.put("ME", "Medelpad");
        m.put("NÄ", "Närke");
        m.put("SK", "Skåne");
        m.put("SM", "Småland");
        m.put("SÖ", "Södermanland");
        m.put("UP", "Uppland");
        m.put("VR", "Värmland");
        m.put("VB", "Västerbotten");
        m.put("VG", "Västergötland");
        m.put("VS", "Västmanland");
        m.put("ÅN", "Ångermanland");
        m.put("ÖL", "Öland");
        m.put("ÖG", "Östergötland");
        return m;
    }

    private static Map<String, String> defaultCountries() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("US", "USA");
        m.put("TR", "Turkiet");
        m.put("RU", "Ryssland");
        m.put("PL", "Polen");
        m.put("NO", "Norge");
        m.put("NL", "Nederländerna");
        m.put("LV", "Lettland");
        m.put("IT", "Italien");
        m.put("IS", "Island");
        m.put("GB", "Storbrittanien");
        m.put("FR", "Frankrike");
        m.put("FI", "Finland");
        m.put("DK", "Danmark");
        m.put("DE", "Tyskland");
        m.put("CZ", "Tjeckien");
        m.put("BE", "Belgien");
        m.put("EE", "Estland");
        return m;
    }
}
