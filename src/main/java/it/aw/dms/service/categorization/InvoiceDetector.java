package it.aw.dms.service.categorization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fatture (Rechnungen): numero fattura, importi, IVA, scadenza di pagamento.
 */
public class InvoiceDetector extends PatternCategoryDetector {

    public static final String CATEGORY = "invoice";

    private static final List<String> SIGNALS = List.of(
            "rechnung(?:snummer)?",
            "\\binvoice\\b",
            "rechnungsdatum|invoice\\s+date",
            "fälligkeitsdatum|due\\s+date",
            "zahlbar\\s+bis|payable\\s+(?:by|within)",
            "netto\\s*betrag|net\\s+amount",
            "brutto\\s*betrag|gross\\s+amount",
            "mehrwertsteuer|\\bmwst\\b|\\bvat\\b",
            "ust\\.?\\s*-?\\s*id|steuer(?:nummer|nr\\.?)|tax\\s+id",
            "lieferant|supplier",
            "rechnungsempfänger|bill\\s+to"
    );

    private static final Map<String, List<String>> ENTITIES = new LinkedHashMap<>();
    static {
        ENTITIES.put("issuer", List.of(
                "(?:rechnungssteller|lieferant|von|from)\\s*:\\s*([^\\n\\r]+)",
                "^\\s*([^\\n\\r]*?\\b(?:GmbH|AG|KG|OHG|UG|Ltd|Inc|LLC)\\b\\.?)"));
        ENTITIES.put("invoice_number", List.of(
                "rechnungs?(?:nummer|[\\s-]*nr\\.?)\\s*:?\\s*([A-Z0-9][A-Z0-9/-]*)",
                "invoice\\s*(?:number|no\\.?|#)\\s*:?\\s*([A-Z0-9][A-Z0-9/-]*)"));
        ENTITIES.put("amount", List.of(
                "(?:gesamtbetrag|rechnungsbetrag|bruttobetrag|gesamt|summe|total|amount\\s+due)\\s*:?\\s*(?:EUR|€)?\\s*([0-9][0-9.,]*[0-9])"));
        ENTITIES.put("date", List.of(
                "(?:rechnungsdatum|invoice\\s+date|datum|date)\\s*:?\\s*(\\d{1,2}\\.\\d{1,2}\\.\\d{4}|\\d{4}-\\d{2}-\\d{2})"));
    }

    public InvoiceDetector() {
        super(CATEGORY, SIGNALS, 5, ENTITIES);
    }
}
