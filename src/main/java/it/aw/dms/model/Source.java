package it.aw.dms.model;

/** Citazione inclusa in una risposta: documento, pagina e breve estratto. */
public record Source(
        String documentPath,
        int    pageNumber,
        String directoryLabel,
        String excerpt
) {}
