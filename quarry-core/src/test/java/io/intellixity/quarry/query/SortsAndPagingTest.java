package io.intellixity.quarry.query;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SortsAndPagingTest {

  @Test
  void parsesSortStrings() {
    assertEquals(List.of(SortField.asc("name"), SortField.desc("store.name"), SortField.asc("sku")),
        Sorts.parse("name, store.name DESC,sku asc"));
    assertEquals(List.of(), Sorts.parse(" , "));
    assertEquals(List.of(), Sorts.parse(null));
  }

  @Test
  void parsesSortMapsAndLists() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("name", -1);
    m.put("sku", 1);
    m.put("id", "desc");
    assertEquals(List.of(SortField.desc("name"), SortField.asc("sku"), SortField.desc("id")), Sorts.parse(m));
    assertEquals(List.of(SortField.desc("a"), SortField.asc("b")), Sorts.parse(List.of("a desc", SortField.asc("b"))));
    assertThrows(QueryArgumentException.class, () -> Sorts.parse(42));
  }

  @Test
  void pagingCoercesNumbersAndNumericStrings() {
    Paging p = Paging.of("10", 20L);
    assertEquals(10, p.limit());
    assertEquals(20, p.skip());
    assertTrue(p.hasLimit());
    assertFalse(Paging.of(0, null).hasLimit());
    assertEquals(3, Paging.limit(3.0).limit());
  }

  @Test
  void pagingRejectsNonNumbers() {
    assertEquals("Limit should be a number",
        assertThrows(QueryArgumentException.class, () -> Paging.limit("abc")).getMessage());
    assertEquals("Skip should be a number",
        assertThrows(QueryArgumentException.class, () -> Paging.NONE.withSkip(Double.NaN)).getMessage());
    assertThrows(QueryArgumentException.class, () -> Paging.limit(-1));
  }
}
