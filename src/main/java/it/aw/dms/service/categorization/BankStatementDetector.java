package it.aw.dms.service.categorization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estratti conto (Kontoauszüge): banca, IBAN/BIC, periodo e saldo.
 */
public class BankStatementDetector extends PatternCategoryDetector {

    public static final String CATEGORY = "bank_statement";

    private static final List<String> SIGNALS = List.of(
            "kontoauszug",
            "bank\\s*statement|account\\s+statement",
            "konto(?:nummer|nr\\.?)|account\\s+number",
            "\\biban\\b",
            "\\bbic\\b",
            "saldo|balance",
            "buchung(?:stag|sdatum)|booking\\s+date",
            "verwendungszweck",
            "überweisung",
            "lastschrift|direct\\s+debit",
            "gutschrift"
    );

    private static final Map<String, List<String>> ENTITIES = new LinkedHashMap<>();
    static {
        ENTITIES.put("bank", List.of(
                "\\bbank\\s*:\\s*([^\\n\\r]+)",
                "^\\s*([^\\n\\r]*?\\b(?:Bank|Sparkasse|Volksbank|Raiffeisenbank)\\b[^\\n\\r]*)"));
        ENTITIES.put("iban", List.of(
                "\\biban\\s*:?\\s*([A-Z]{2}\\d{2}(?: ?[A-Z0-9]{4}){2,7}(?: ?[A-Z0-9]{1,3})?)"));
        ENTITIES.put("bic", List.of(
                "\\bbic\\s*:?\\s*([A-Z]{6}[A-Z0-9]{2}(?:[A-Z0-9]{3})?)\\b"));
        ENTITIES.put("period", List.of(
                "(?:vom|von|from)\\s*(\\d{1,2}\\.\\d{1,2}\\.\\d{4}\\s*(?:bis|to|-)\\s*\\d{1,2}\\.\\d{1,2}\\.\\d{4})"));
        ENTITIES.put("balance", List.of(
                "(?:neuer\\s+saldo|endsaldo|closing\\s+balance|saldo)\\s*:?\\s*([+-]?\\s?[0-9][0-9.,]*[0-9])"));
    }

    public BankStatementDetector() {
        super(CATEGORY, SIGNALS, 5, ENTITIES);
    }
}
