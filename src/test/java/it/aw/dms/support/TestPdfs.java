package it.aw.dms.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * PDF di prova generati con PDFBox. Ogni elemento di {@code pages} è una pagina,
 * ogni riga della pagina è separata da "\n"; una pagina vuota non ha testo.
 */
public final class TestPdfs {

    private TestPdfs() {}

    public static Path write(Path file, List<String> pages) throws IOException {
        try (PDDocument doc = build(pages)) {
            Files.createDirectories(file.toAbsolutePath().getParent());
            doc.save(file.toFile());
        }
        return file;
    }

    public static Path writeEncrypted(Path file, String text) throws IOException {
        try (PDDocument doc = build(List.of(text))) {
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-pw", "user-pw", new AccessPermission());
            policy.setEncryptionKeyLength(128);
            doc.protect(policy);
            doc.save(file.toFile());
        }
        return file;
    }

    public static Path writeWithoutPages(Path file) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            doc.save(file.toFile());
        }
        return file;
    }

    /** Testo di almeno {@code minChars} caratteri, su più righe. */
    public static String filler(String sentence, int minChars) {
        StringBuilder sb = new StringBuilder();
        while (sb.length() < minChars) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(sentence);
        }
        return sb.toString();
    }

    private static PDDocument build(List<String> pages) throws IOException {
        PDDocument doc = new PDDocument();
        PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        for (String text : pages) {
            PDPage page = new PDPage();
            doc.addPage(page);
            if (text == null || text.isEmpty()) continue;
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.beginText();
                cs.setFont(font, 10);
                cs.setLeading(12);
                cs.newLineAtOffset(40, 750);
                for (String line : text.split("\n")) {
                    cs.showText(line);
                    cs.newLine();
                }
                cs.endText();
            }
        }
        return doc;
    }
}
