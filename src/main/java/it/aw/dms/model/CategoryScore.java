package it.aw.dms.model;

/** Coppia (categoria, confidenza) usata per le categorie alternative. */
public record CategoryScore(String category, double confidence) {}
