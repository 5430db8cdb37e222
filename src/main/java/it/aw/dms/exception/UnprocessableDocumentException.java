package it.aw.dms.exception;

import java.nio.file.Path;

/**
 * Documento da cui non è possibile estrarre testo: zero pagine, struttura corrotta,
 * PDF cifrato o nessun testo né diretto né OCR.
 * L'import batch registra il fallimento e passa al documento successivo.
 */
public class UnprocessableDocumentException extends DmsException {

    private final transient Path path;

    public UnprocessableDocumentException(Path path, String reason) {
        this(path, reason, null);
    }

    public UnprocessableDocumentException(Path path, String reason, Throwable cause) {
        super(ErrorKind.UNPROCESSABLE_DOCUMENT,
                "Documento non elaborabile: " + path + " (" + reason + ")",
                "Verificare che il file si apra in un lettore PDF; se protetto da password rimuoverla prima dell'import.",
                cause);
        this.path = path;
    }

    public Path getPath() { return path; }
}
