package io.intellixity.quarry.query;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Parses the accepted sort spellings into {@link SortField}s:
 * <ul>
 *   <li>{@code "name asc, createdAt desc"}</li>
 *   <li>{@code ["name", "createdAt desc"]}</li>
 *   <li>{@code {name: 1, createdAt: -1}} or {@code {createdAt: "desc"}}</li>
 *   <li>a list of {@link SortField}</li>
 * </ul>
 */
public final class Sorts {
  private static final Pattern DESC = Pattern.compile("desc", Pattern.CASE_INSENSITIVE);

  private Sorts() {}

  public static List<SortField> parse(Object sort) {
    if (sort == null) return List.of();
    if (sort instanceof SortField sf) return List.of(sf);
    if (sort instanceof String s) return parseString(s);
    if (sort instanceof Map<?, ?> m) return parseMap(m);
    if (sort instanceof Collection<?> c) {
      List<SortField> out = new ArrayList<>();
      for (Object item : c) {
        if (item instanceof SortField sf) out.add(sf);
        else if (item instanceof String s) out.add(parseOne(s));
        else throw new QueryArgumentException("Unsupported sort item: " + item);
      }
      return List.copyOf(out);
    }
    throw new QueryArgumentException("Unsupported sort: " + sort);
  }

  private static List<SortField> parseString(String s) {
    List<SortField> out = new ArrayList<>();
    for (String part : s.split(",")) {
      if (part.isBlank()) continue;
      out.add(parseOne(part));
    }
    return List.copyOf(out);
  }

  private static SortField parseOne(String part) {
    String[] tokens = part.trim().split("\\s+");
    String property = tokens[0];
    String rest = String.join("", Arrays.asList(tokens).subList(1, tokens.length));
    return new SortField(property, DESC.matcher(rest).find() ? SortField.Direction.DESC : SortField.Direction.ASC);
  }

  private static List<SortField> parseMap(Map<?, ?> m) {
    List<SortField> out = new ArrayList<>();
    for (var e : m.entrySet()) {
      Object order = e.getValue();
      boolean desc = (order instanceof Number n && n.intValue() == -1)
          || (order != null && DESC.matcher(String.valueOf(order)).find());
      out.add(new SortField(String.valueOf(e.getKey()), desc ? SortField.Direction.DESC : SortField.Direction.ASC));
    }
    return List.copyOf(out);
  }
}
