package it.aw.dms.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Directory label di un file: il percorso della sua cartella relativo alla radice
 * dell'import, con "/" come separatore ("" se il file è direttamente nella radice).
 */
public final class DirectoryLabels {

    private DirectoryLabels() {}

    public static String labelFor(Path root, Path file) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path parent = file.toAbsolutePath().normalize().getParent();
        if (parent == null || !parent.startsWith(normalizedRoot)) {
            throw new IllegalArgumentException(file + " non si trova sotto " + root);
        }
        return join(normalizedRoot.relativize(parent));
    }

    /** Label per un file importato singolarmente: il nome della cartella che lo contiene. */
    public static String labelFor(Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        if (parent == null || parent.getFileName() == null) return "";
        return parent.getFileName().toString();
    }

    private static String join(Path relative) {
        List<String> segments = new ArrayList<>();
        for (Path segment : relative) {
            String s = segment.toString();
            if (!s.isEmpty()) segments.add(s);
        }
        return String.join("/", segments);
    }
}
