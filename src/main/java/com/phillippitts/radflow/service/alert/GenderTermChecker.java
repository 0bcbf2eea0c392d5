package com.phillippitts.radflow.service.alert;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds sex-specific anatomy in a report that contradicts the patient's recorded gender.
 */
public final class GenderTermChecker {

    private static final List<String> MALE_ONLY = List.of(
            "prostate", "prostatic", "testis", "testes", "testicle", "testicular",
            "scrotum", "scrotal", "seminal vesicle", "seminal vesicles", "penis", "penile", "epididymis");

    private static final List<String> FEMALE_ONLY = List.of(
            "uterus", "uterine", "ovary", "ovaries", "ovarian", "endometrium", "endometrial",
            "fallopian", "cervix uteri", "vagina", "vaginal", "adnexa", "adnexal");

    private static final Pattern MALE = alternation(MALE_ONLY);
    private static final Pattern FEMALE = alternation(FEMALE_ONLY);

    private GenderTermChecker() {}

    private static Pattern alternation(List<String> terms) {
        List<String> quoted = terms.stream().map(Pattern::quote).toList();
        return Pattern.compile("\\b(" + String.join("|", quoted) + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    /**
     * @param reportText report text; null or blank yields no conflicts
     * @param gender     patient gender as scraped ("Male", "Female", "M", "F"); unknown yields no conflicts
     * @return distinct conflicting terms in order of first appearance, lower-cased
     */
    public static List<String> conflictingTerms(String reportText, String gender) {
        if (reportText == null || reportText.isBlank() || gender == null) {
            return List.of();
        }
        String g = gender.trim().toUpperCase(Locale.ROOT);
        Pattern conflicting;
        if (g.equals("MALE") || g.equals("M")) {
            conflicting = FEMALE;
        } else if (g.equals("FEMALE") || g.equals("F")) {
            conflicting = MALE;
        } else {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        Matcher m = conflicting.matcher(reportText);
        while (m.find()) {
            String term = m.group(1).toLowerCase(Locale.ROOT);
            if (!found.contains(term)) {
                found.add(term);
            }
        }
        return found;
    }
}
