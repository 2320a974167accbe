/*
 * Copyright 2026 The ext-authz Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.extauthz;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * A reference into the policy document tree, such as {@code data.envoy.authz.allow}, whose value
 * is evaluated to produce the decision for each check call.
 *
 * <p>An entry point is resolved once when the configuration is loaded. It is either derived from a
 * slash separated path relative to the {@code data} root document, or parsed from a reference
 * expression.
 */
@AutoValue
public abstract class EntryPoint {

  /** The name of the root document that paths are resolved against. */
  public static final String DATA_ROOT = "data";

  /** One element of a reference: either an object key or an array index. */
  @AutoOneOf(Term.Kind.class)
  public abstract static class Term {
    public enum Kind { KEY, INDEX }

    public abstract Kind getKind();

    public abstract String key();

    public abstract Long index();

    public static Term ofKey(String key) {
      return AutoOneOf_EntryPoint_Term.key(key);
    }

    public static Term ofIndex(long index) {
      return AutoOneOf_EntryPoint_Term.index(index);
    }
  }

  /** Name of the root variable, {@code data} for every path derived reference. */
  public abstract String root();

  /** The elements that follow the root variable. */
  public abstract ImmutableList<Term> terms();

  static EntryPoint create(String root, ImmutableList<Term> terms) {
    return new AutoValue_EntryPoint(root, terms);
  }

  /**
   * Converts a slash separated path such as {@code envoy/authz/allow} into a reference rooted at
   * {@code data}. Empty segments are skipped, segments that parse as integers become array
   * indices and everything else becomes an object key.
   */
  public static EntryPoint fromPath(String path) {
    checkNotNull(path, "path");
    ImmutableList.Builder<Term> terms = ImmutableList.builder();
    for (String segment : Splitter.on('/').omitEmptyStrings().split(path)) {
      Long index = parseIndex(segment);
      terms.add(index != null ? Term.ofIndex(index) : Term.ofKey(segment));
    }
    return create(DATA_ROOT, terms.build());
  }

  /**
   * Parses a reference expression such as {@code data.envoy.authz["allow"]} or
   * {@code data.rules[0]}.
   *
   * @throws IllegalArgumentException if {@code query} is not a well formed reference
   */
  public static EntryPoint parse(String query) {
    checkNotNull(query, "query");
    return new RefParser(query.trim()).parse();
  }

  /** Returns the reference in its canonical textual form, for example {@code data.foo[0]}. */
  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder(root());
    for (Term term : terms()) {
      switch (term.getKind()) {
        case INDEX:
          sb.append('[').append(term.index()).append(']');
          break;
        case KEY:
          if (isIdentifier(term.key())) {
            sb.append('.').append(term.key());
          } else {
            sb.append('[').append(quote(term.key())).append(']');
          }
          break;
        default:
          throw new AssertionError(term.getKind());
      }
    }
    return sb.toString();
  }

  private static Long parseIndex(String segment) {
    try {
      return Long.parseLong(segment);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static boolean isIdentifier(String s) {
    if (s.isEmpty() || !isIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      if (!isIdentifierPart(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isIdentifierStart(char c) {
    return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9');
  }

  private static String quote(String s) {
    StringBuilder sb = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  /** Recursive descent parser for {@code var ( "." ident | "[" (string | int) "]" )*}. */
  private static final class RefParser {
    private final String input;
    private int pos;

    RefParser(String input) {
      this.input = input;
    }

    EntryPoint parse() {
      checkArgument(!input.isEmpty(), "empty query");
      String root = identifier();
      ImmutableList.Builder<Term> terms = ImmutableList.builder();
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '.') {
          pos++;
          terms.add(Term.ofKey(identifier()));
        } else if (c == '[') {
          pos++;
          terms.add(bracketed());
          expect(']');
        } else {
          throw error("unexpected character '" + c + "'");
        }
      }
      return create(root, terms.build());
    }

    private String identifier() {
      int start = pos;
      if (pos < input.length() && isIdentifierStart(input.charAt(pos))) {
        pos++;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
          pos++;
        }
      }
      if (start == pos) {
        throw error("expected identifier");
      }
      return input.substring(start, pos);
    }

    private Term bracketed() {
      if (pos < input.length() && input.charAt(pos) == '"') {
        return Term.ofKey(string());
      }
      int start = pos;
      if (pos < input.length() && input.charAt(pos) == '-') {
        pos++;
      }
      while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
        pos++;
      }
      Long index = parseIndex(input.substring(start, pos));
      if (index == null) {
        throw error("expected string or integer");
      }
      return Term.ofIndex(index);
    }

    private String string() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (true) {
        if (pos >= input.length()) {
          throw error("unterminated string");
        }
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw error("unterminated escape");
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"':
          case '\\':
          case '/':
            sb.append(escaped);
            break;
          case 'n':
            sb.append('\n');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 'u':
            if (pos + 4 > input.length()) {
              throw error("truncated unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw error("invalid unicode escape");
            }
            pos += 4;
            break;
          default:
            throw error("invalid escape '\\" + escaped + "'");
        }
      }
    }

    private void expect(char c) {
      if (pos >= input.length() || input.charAt(pos) != c) {
        throw error("expected '" + c + "'");
      }
      pos++;
    }

    private IllegalArgumentException error(String message) {
      return new IllegalArgumentException(
          String.format("invalid query %s: %s at offset %d", quote(input), message, pos));
    }
  }
}
