package com.dfisemesh.dfise;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SectionScanner {
    private static final Pattern HEADER = Pattern.compile("^([A-Za-z_][\\w-]*)\\s*(?:\\((.*)\\))?$");

    private SectionScanner() {
    }

    public static Decoded<List<Section>> scan(String text, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        List<Section> roots = new ArrayList<>();
        Deque<OpenSection> open = new ArrayDeque<>();
        String pendingRootText = null;

        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i];
            StringBuilder segment = new StringBuilder();
            boolean inString = false;

            for (int k = 0; k < line.length(); k++) {
                char c = line.charAt(k);
                if (c == '"') {
                    inString = !inString;
                    segment.append(c);
                } else if (!inString && c == '{') {
                    String header = segment.toString().trim();
                    segment.setLength(0);
                    int headerLine = lineNumber;
                    if (header.isEmpty()) {
                        if (!open.isEmpty() && !open.peek().lines.isEmpty()) {
                            SectionLine previous = open.peek().lines.remove(open.peek().lines.size() - 1);
                            header = previous.text();
                            headerLine = previous.number();
                        } else if (open.isEmpty() && pendingRootText != null) {
                            header = pendingRootText;
                            headerLine = lineNumber - 1;
                        }
                    }
                    pendingRootText = null;
                    open.push(OpenSection.of(header, headerLine));
                } else if (!inString && c == '}') {
                    addText(open, segment.toString(), lineNumber);
                    segment.setLength(0);
                    if (open.isEmpty()) {
                        Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, lineNumber, "Unmatched closing brace");
                        continue;
                    }
                    attach(open, roots, open.pop().close(true));
                } else {
                    segment.append(c);
                }
            }

            String rest = segment.toString().trim();
            if (open.isEmpty()) {
                if (!rest.isEmpty()) {
                    pendingRootText = rest;
                }
            } else {
                addText(open, rest, lineNumber);
            }
        }

        while (!open.isEmpty()) {
            OpenSection unterminated = open.pop();
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, unterminated.headerLine,
                    "Block '" + unterminated.name + "' is not terminated before end of input");
            attach(open, roots, unterminated.close(false));
        }
        return new Decoded<>(roots, issues);
    }

    private static void addText(Deque<OpenSection> open, String text, int lineNumber) {
        String trimmed = text.trim();
        if (!trimmed.isEmpty() && !open.isEmpty()) {
            open.peek().lines.add(new SectionLine(lineNumber, trimmed));
        }
    }

    private static void attach(Deque<OpenSection> open, List<Section> roots, Section section) {
        if (open.isEmpty()) {
            roots.add(section);
        } else {
            open.peek().children.add(section);
        }
    }

    private static final class OpenSection {
        final String name;
        final String argument;
        final int headerLine;
        final List<SectionLine> lines = new ArrayList<>();
        final List<Section> children = new ArrayList<>();

        private OpenSection(String name, String argument, int headerLine) {
            this.name = name;
            this.argument = argument;
            this.headerLine = headerLine;
        }

        static OpenSection of(String header, int headerLine) {
            Matcher m = HEADER.matcher(header);
            if (m.matches()) {
                String argument = m.group(2) == null ? null : m.group(2).trim();
                return new OpenSection(m.group(1), argument, headerLine);
            }
            return new OpenSection(header, null, headerLine);
        }

        Section close(boolean closed) {
            return new Section(name, argument, headerLine, lines, children, closed);
        }
    }
}
