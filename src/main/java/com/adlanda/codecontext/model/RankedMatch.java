package com.adlanda.codecontext.model;

/**
 * A fragment scored against a query.
 *
 * @param file        The file the fragment belongs to
 * @param fragment    The matched fragment
 * @param similarity  Cosine similarity in [-1, 1]
 */
public record RankedMatch(SourceFile file, Fragment fragment, double similarity) {

    /**
     * Returns a copy with the similarity rounded to two decimal places.
     */
    public RankedMatch rounded() {
        return new RankedMatch(file, fragment, Math.round(similarity * 100) / 100.0);
    }
}
