package org.sample;

import java.util.ArrayList;
import java.util.List;

public final class Sample {

    private final List<String> lines = new ArrayList<>();

    public void add(String line) {
        if (line != null && !line.isBlank()) {
            lines.add(line.strip());
        }
    }

    public int size() {
        return lines.size();
    }
}
