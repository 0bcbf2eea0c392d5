package com.phillippitts.radflow.domain;

/**
 * One scrape of the reporting application's current case. Any field may be null when the
 * scraper could not read it.
 */
public record CaseSnapshot(String accession,
                           String reportText,
                           Boolean drafted,
                           String templateName,
                           String description,
                           String patientGender) {

    public static CaseSnapshot empty() {
        return new CaseSnapshot(null, null, null, null, null, null);
    }

    public String accessionOrEmpty() {
        return accession == null ? "" : accession.trim();
    }

    public String reportTextOrEmpty() {
        return reportText == null ? "" : reportText;
    }

    public boolean isDrafted() {
        return Boolean.TRUE.equals(drafted);
    }
}
