package it.aw.dms.service.categorization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contratti (Verträge): parti, tipo di contratto, durata.
 */
public class ContractDetector extends PatternCategoryDetector {

    public static final String CATEGORY = "contract";

    private static final List<String> SIGNALS = List.of(
            "vertrag",
            "\\bcontract\\b",
            "vereinbarung",
            "\\bagreement\\b",
            "vertragspartner|\\bparties\\b",
            "laufzeit|term\\s+of",
            "kündigung(?:sfrist)?|termination",
            "vertragsgegenstand|subject\\s+matter",
            "§\\s*\\d+",
            "(?:artikel|article)\\s*\\d+",
            "unterschrift|signature"
    );

    private static final Map<String, List<String>> ENTITIES = new LinkedHashMap<>();
    static {
        ENTITIES.put("party", List.of(
                "vertragspartner\\s*:?\\s*([^\\n\\r]+)",
                "zwischen\\s+([^\\n\\r]+?)\\s+(?:und|vertreten)\\b",
                "between\\s+([^\\n\\r]+?)\\s+and\\b",
                "auftraggeber\\s*:?\\s*([^\\n\\r]+)"));
        ENTITIES.put("contract_type", List.of(
                "\\b([A-Za-zÄÖÜäöüß]+vertrag)\\b",
                "vertragsgegenstand\\s*:?\\s*([^\\n\\r]+)"));
        ENTITIES.put("term", List.of(
                "laufzeit\\s*:?\\s*([^\\n\\r]+)",
                "(?:beginnt|gültig)\\s*(?:am|vom|ab)\\s*(\\d{1,2}\\.\\d{1,2}\\.\\d{4})"));
    }

    public ContractDetector() {
        super(CATEGORY, SIGNALS, 5, ENTITIES);
    }
}
