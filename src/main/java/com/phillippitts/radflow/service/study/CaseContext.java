package com.phillippitts.radflow.service.study;

/**
 * Read-only view of the live case. Fields other than the accession fill in lazily as the
 * poller and the actions learn about the case.
 *
 * @param accession             open case, null when no case is open
 * @param description           study description, null until scraped
 * @param signed                a sign action ran for this case
 * @param discardRequested      a discard action ran, or the discard confirmation was seen
 * @param baselineReport        report text captured once the report stabilized, null until then
 * @param processPressed        a process action ran for this case
 * @param protocolFlag          case was classified as a stroke-protocol case when it opened
 * @param pendingMacros         macro text waiting for the report template, null when none
 * @param criticalNoteRequested an automatic critical note was already requested
 */
public record CaseContext(String accession,
                          String description,
                          boolean signed,
                          boolean discardRequested,
                          String baselineReport,
                          boolean processPressed,
                          boolean protocolFlag,
                          String pendingMacros,
                          boolean criticalNoteRequested) {

    public static CaseContext closed() {
        return new CaseContext(null, null, false, false, null, false, false, null, false);
    }

    public boolean isOpen() {
        return accession != null;
    }
}
