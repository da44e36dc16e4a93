package io.intellixity.quarry.postgres;

import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.InMemoryModelRegistry;
import io.intellixity.quarry.schema.ModelMetadata;

/** Shared catalog fixture: products belong to stores; kitchen_sink carries one column of every type. */
public final class TestModels {
  public static final ModelMetadata STORE = ModelMetadata.builder("Store")
      .table("stores")
      .column(ColumnMetadata.builder("id").type("integer").primary())
      .column(ColumnMetadata.builder("name").type("string").maxLength(20))
      .column(ColumnMetadata.builder("products").collection("Product", "store"))
      .build();

  public static final ModelMetadata PRODUCT = ModelMetadata.builder("Product")
      .table("products")
      .column(ColumnMetadata.builder("id").type("integer").primary())
      .column(ColumnMetadata.builder("name").type("string").required().maxLength(50))
      .column(ColumnMetadata.builder("sku").type("string"))
      .column(ColumnMetadata.builder("location").type("string"))
      .column(ColumnMetadata.builder("aliases").column("alias_names").type("array").maxLength(20))
      .column(ColumnMetadata.builder("store").column("store_id").model("Store").required())
      .column(ColumnMetadata.builder("categories").collection("Category", "product"))
      .build();

  public static final ModelMetadata CATEGORY = ModelMetadata.builder("Category")
      .table("categories")
      .column(ColumnMetadata.builder("id").type("uuid").primary())
      .column(ColumnMetadata.builder("name").type("string"))
      .column(ColumnMetadata.builder("product").column("product_id").model("Product"))
      .build();

  public static final ModelMetadata KITCHEN_SINK = ModelMetadata.builder("KitchenSink")
      .table("kitchen_sink")
      .column(ColumnMetadata.builder("id").type("integer").primary())
      .column(ColumnMetadata.builder("name").type("string"))
      .column(ColumnMetadata.builder("intColumn").column("int_column").type("integer"))
      .column(ColumnMetadata.builder("floatColumn").column("float_column").type("float"))
      .column(ColumnMetadata.builder("boolColumn").column("bool_column").type("boolean"))
      .column(ColumnMetadata.builder("uuidColumn").column("uuid_column").type("uuid"))
      .column(ColumnMetadata.builder("stringArray").column("string_array").type("string[]").maxLength(5))
      .column(ColumnMetadata.builder("intArray").column("int_array").type("integer[]"))
      .column(ColumnMetadata.builder("bar").type("json"))
      .column(ColumnMetadata.builder("status").type("string").defaultsTo("draft"))
      .column(ColumnMetadata.builder("createdAt").column("created_at").type("datetime").createDate())
      .column(ColumnMetadata.builder("updatedAt").column("updated_at").type("datetime").updateDate())
      .column(ColumnMetadata.builder("version").type("integer").version())
      .build();

  public static final ModelMetadata REPORTING = ModelMetadata.builder("Report")
      .schema("reporting")
      .table("reports")
      .column(ColumnMetadata.builder("id").type("integer").primary())
      .column(ColumnMetadata.builder("title").type("string"))
      .build();

  public static final InMemoryModelRegistry REGISTRY =
      InMemoryModelRegistry.of(STORE, PRODUCT, CATEGORY, KITCHEN_SINK, REPORTING);

  private TestModels() {}
}
