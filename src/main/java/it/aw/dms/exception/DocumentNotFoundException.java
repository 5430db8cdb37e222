package it.aw.dms.exception;

public class DocumentNotFoundException extends DmsException {

    public DocumentNotFoundException(String documentId) {
        super(ErrorKind.NOT_FOUND, "Documento non trovato: " + documentId);
    }
}
