package com.flamingo.dozor.service.parsing;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line into whitespace-separated tokens the way a POSIX shell does: single quotes group
 * literally, double quotes group with backslash escapes, and a backslash outside quotes escapes the
 * next character. An unterminated quote closes at end of line.
 */
final class LineTokenizer {

  private LineTokenizer() {}

  static List<String> tokenize(String line) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    char quote = 0;

    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote == '\'') {
        if (c == '\'') {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (quote == '"') {
        if (c == '"') {
          quote = 0;
        } else if (c == '\\' && isDoubleQuoteEscapable(line, i + 1)) {
          current.append(line.charAt(++i));
        } else {
          current.append(c);
        }
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          tokens.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
        inToken = true;
      } else if (c == '\\') {
        if (i + 1 < line.length()) {
          current.append(line.charAt(++i));
        }
        inToken = true;
      } else {
        current.append(c);
        inToken = true;
      }
    }
    if (inToken) {
      tokens.add(current.toString());
    }
    return tokens;
  }

  private static boolean isDoubleQuoteEscapable(String line, int index) {
    if (index >= line.length()) {
      return false;
    }
    char c = line.charAt(index);
    return c == '"' || c == '\\' || c == '$' || c == '`';
  }
}
