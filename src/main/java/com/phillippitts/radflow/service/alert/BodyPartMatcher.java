package com.phillippitts.radflow.service.alert;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compares the body parts named by a study description with those named by the report
 * template, to catch a report dictated into the wrong template.
 */
public final class BodyPartMatcher {

    private static final List<String> BODY_PARTS = List.of(
            "HEAD", "BRAIN", "NECK", "CERVICAL", "C-SPINE", "CSPINE",
            "CHEST", "THORAX", "THORACIC", "T-SPINE", "TSPINE", "LUNG",
            "ABDOMEN", "ABDOMINAL", "PELVIS", "PELVIC",
            "LUMBAR", "L-SPINE", "LSPINE", "SPINE",
            "EXTREMITY", "UPPER EXTREMITY", "LOWER EXTREMITY",
            "ARM", "LEG", "SHOULDER", "HIP", "KNEE", "ANKLE", "WRIST", "ELBOW",
            "FOOT", "HAND", "FINGER", "TOE",
            "CARDIAC", "HEART", "CORONARY",
            "CTA", "MRA", "ANGIOGRAPHY", "ANGIOGRAM", "VENOGRAM",
            "PULMONARY VEINS", "PULMONARY ARTERIES", "PULMONARY EMBOLISM", "PE PROTOCOL",
            "AORTA", "AORTIC", "RUNOFF", "CAROTID",
            "SINUS", "ORBIT", "FACE", "FACIAL", "MAXILLOFACIAL", "TEMPORAL", "IAC",
            "RENAL", "KIDNEY", "UROGRAM", "ENTEROGRAPHY", "LIVER", "PANCREAS");

    private static final Map<String, String> SYNONYMS = Map.ofEntries(
            Map.entry("ABDOMINAL", "ABDOMEN"),
            Map.entry("PELVIC", "PELVIS"),
            Map.entry("C-SPINE", "CERVICAL"),
            Map.entry("CSPINE", "CERVICAL"),
            Map.entry("T-SPINE", "THORACIC"),
            Map.entry("TSPINE", "THORACIC"),
            Map.entry("L-SPINE", "LUMBAR"),
            Map.entry("LSPINE", "LUMBAR"),
            Map.entry("THORAX", "CHEST"),
            Map.entry("LUNG", "CHEST"),
            Map.entry("BRAIN", "HEAD"),
            Map.entry("ANGIOGRAPHY", "CTA"),
            Map.entry("ANGIOGRAM", "CTA"),
            Map.entry("AORTIC", "AORTA"),
            Map.entry("FACIAL", "FACE"),
            Map.entry("MAXILLOFACIAL", "FACE"));

    private BodyPartMatcher() {}

    /**
     * Canonical body parts mentioned in {@code text} (substring match, upper-cased).
     */
    public static Set<String> extract(String text) {
        Set<String> result = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.contains("CT ANGIO")) {
            result.add("CTA");
        }
        if (upper.contains("MR ANGIO")) {
            result.add("MRA");
        }
        for (String part : BODY_PARTS) {
            if (upper.contains(part)) {
                result.add(SYNONYMS.getOrDefault(part, part));
            }
        }
        return result;
    }

    /**
     * True when the two sides agree, or when either side is blank or names no known body part.
     */
    public static boolean matches(String description, String templateName) {
        if (description == null || description.isBlank() || templateName == null || templateName.isBlank()) {
            return true;
        }
        Set<String> described = extract(description);
        Set<String> templated = extract(templateName);
        if (described.isEmpty() || templated.isEmpty()) {
            return true;
        }
        return described.equals(templated);
    }
}
