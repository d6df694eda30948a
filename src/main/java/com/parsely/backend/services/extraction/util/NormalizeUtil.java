package com.parsely.backend.services.extraction.util;

public class NormalizeUtil {

    /**
     * Cleans a single input line without collapsing inner spacing. Text from PDF extraction often
     * carries NBSP and figure spaces that {@code \s} does not match.
     */
    public static String cleanLine(String line) {
        if (line == null) return "";
        String result = line.replace(String.valueOf((char) 0), "");
        result = result.replace('\u00A0', ' ').replace('\u2007', ' ').replace('\u202F', ' ');
        result = result.replace("\t", "    ");
        return result.strip();
    }
}
