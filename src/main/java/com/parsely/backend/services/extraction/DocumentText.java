package com.parsely.backend.services.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.parsely.backend.services.extraction.util.NormalizeUtil;

/**
 * Invoice text as an ordered list of lines plus the joined form used by whole-text patterns.
 * Lines are cleaned of NUL and non-breaking spaces and trimmed; inner runs of spaces are kept
 * because two-column layouts are split on them.
 */
public record DocumentText(List<String> lines, String text) {

    public DocumentText {
        lines = lines == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(lines));
        text = text == null ? "" : text;
    }

    public static DocumentText of(List<String> rawLines) {
        List<String> cleaned = new ArrayList<>();
        if (rawLines != null) {
            for (String line : rawLines) {
                cleaned.add(NormalizeUtil.cleanLine(line));
            }
        }
        return new DocumentText(cleaned, String.join("\n", cleaned));
    }

    public static DocumentText ofText(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return of(List.of());
        }
        return of(List.of(rawText.split("\\r?\\n", -1)));
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public List<String> nonBlankLines() {
        List<String> out = new ArrayList<>();
        for (String line : lines) {
            if (!line.isBlank()) out.add(line);
        }
        return out;
    }
}
