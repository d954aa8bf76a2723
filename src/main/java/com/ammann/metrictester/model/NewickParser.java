/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.PhylogeneticTree.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for Newick tree strings.
 *
 * <p>Supports nested clades, quoted labels ({@code 'a b'}, with {@code ''} as an escaped quote),
 * bracketed comments and optional branch lengths. The trailing semicolon is optional.
 */
final class NewickParser {

    private final String text;
    private int position;

    NewickParser(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Newick string must not be empty");
        }
        this.text = text;
    }

    Node parse() {
        Node root = parseSubtree();
        skipIgnorable();
        if (peek() == ';') {
            position++;
            skipIgnorable();
        }
        if (position < text.length()) {
            throw error("unexpected trailing content");
        }
        return root;
    }

    private Node parseSubtree() {
        skipIgnorable();
        List<Node> children = new ArrayList<>();
        if (peek() == '(') {
            position++;
            children.add(parseSubtree());
            skipIgnorable();
            while (peek() == ',') {
                position++;
                children.add(parseSubtree());
                skipIgnorable();
            }
            if (peek() != ')') {
                throw error("expected ')'");
            }
            position++;
        }
        String label = parseLabel();
        double length = parseLength();
        if (children.isEmpty() && label == null) {
            throw error("tip without a label");
        }
        return new Node(label, length, children);
    }

    private String parseLabel() {
        skipIgnorable();
        if (peek() == '\'') {
            return parseQuotedLabel();
        }
        int start = position;
        while (position < text.length() && !isDelimiter(text.charAt(position))) {
            position++;
        }
        String label = text.substring(start, position).trim();
        return label.isEmpty() ? null : label;
    }

    private String parseQuotedLabel() {
        StringBuilder label = new StringBuilder();
        position++;
        while (true) {
            if (position >= text.length()) {
                throw error("unterminated quoted label");
            }
            char c = text.charAt(position++);
            if (c == '\'') {
                if (peek() == '\'') {
                    label.append('\'');
                    position++;
                    continue;
                }
                return label.toString();
            }
            label.append(c);
        }
    }

    private double parseLength() {
        skipIgnorable();
        if (peek() != ':') {
            return Double.NaN;
        }
        position++;
        skipIgnorable();
        int start = position;
        while (position < text.length() && !isDelimiter(text.charAt(position))) {
            position++;
        }
        String number = text.substring(start, position).trim();
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            throw new ValidationException(
                    String.format("Malformed Newick string at position %d: invalid branch length '%s'",
                            start, number), e);
        }
    }

    private void skipIgnorable() {
        while (position < text.length()) {
            char c = text.charAt(position);
            if (Character.isWhitespace(c)) {
                position++;
            } else if (c == '[') {
                int end = text.indexOf(']', position);
                if (end < 0) {
                    throw error("unterminated comment");
                }
                position = end + 1;
            } else {
                return;
            }
        }
    }

    private char peek() {
        return position < text.length() ? text.charAt(position) : '\0';
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == ',' || c == ':' || c == ';' || c == '[';
    }

    private ValidationException error(String reason) {
        return new ValidationException(
                String.format("Malformed Newick string at position %d: %s", position, reason));
    }
}
