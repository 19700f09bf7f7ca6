package com.dfisemesh.dfise;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

public record Section(String name,
                      String argument,
                      int headerLine,
                      List<SectionLine> lines,
                      List<Section> children,
                      boolean closed) {
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");

    public Section {
        lines = List.copyOf(lines);
        children = List.copyOf(children);
    }

    public OptionalInt declaredCount() {
        if (argument == null || !INTEGER.matcher(argument).matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(argument));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public Optional<String> label() {
        if (argument == null || argument.length() < 2 || !argument.startsWith("\"") || !argument.endsWith("\"")) {
            return Optional.empty();
        }
        return Optional.of(argument.substring(1, argument.length() - 1));
    }

    public Optional<Section> child(String childName) {
        return children.stream().filter(c -> c.name.equals(childName)).findFirst();
    }
}
