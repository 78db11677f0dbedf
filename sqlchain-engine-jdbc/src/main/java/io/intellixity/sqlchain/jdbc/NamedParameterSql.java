package io.intellixity.sqlchain.jdbc;

import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.reflect.PropertyMetadata;
import io.intellixity.sqlchain.spi.CommandParameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compiles caller-written SQL fragments containing named parameters (e.g. :customerId) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single quotes are ignored.\n
 * - Names are matched to arguments ignoring case; a param used twice is bound twice.\n
 */
public final class NamedParameterSql {
  private NamedParameterSql() {}

  /** JDBC text plus the parameters in placeholder order. */
  public record Compiled(String sql, List<CommandParameter> parameters) {
    public Compiled {
      parameters = List.copyOf(parameters);
    }
  }

  public static Compiled compile(String sql, Map<String, ?> arguments) {
    if (sql == null) return new Compiled("", List.of());
    Map<String, Object> effective = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (arguments != null) effective.putAll(arguments);

    StringBuilder out = new StringBuilder(sql.length() + 16);
    List<CommandParameter> params = new ArrayList<>();
    boolean inSingleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        // Handle '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && ch == ':') {
        // Skip :: casts
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          params.add(new CommandParameter(name, getRequired(effective, name)));
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return new Compiled(out.toString(), params);
  }

  /**
   * Arguments for a fragment: a {@link Map} as is, otherwise the readable properties of {@code source}
   * under both their property names and their mapped column names.
   */
  public static Map<String, Object> argumentsOf(Object source, ClassMetadataCache types) {
    if (source == null) return Map.of();
    if (source instanceof Map<?, ?> m) {
      Map<String, Object> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), e.getValue());
      return Collections.unmodifiableMap(out);
    }
    Map<String, Object> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (PropertyMetadata p : types.get(source.getClass()).properties()) {
      if (!p.canRead() || p.decompose()) continue;
      Object v = p.get(source);
      out.put(p.name(), v);
      if (p.mappedColumnName() != null) out.putIfAbsent(p.mappedColumnName(), v);
    }
    return Collections.unmodifiableMap(out);
  }

  private static Object getRequired(Map<String, Object> params, String name) {
    if (params.containsKey(name)) return params.get(name);
    throw new IllegalArgumentException("Missing query param: " + name);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
