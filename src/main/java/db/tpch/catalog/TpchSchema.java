package db.tpch.catalog;

import static db.tpch.catalog.ColumnSchema.bigint;
import static db.tpch.catalog.ColumnSchema.date;
import static db.tpch.catalog.ColumnSchema.decimal;
import static db.tpch.catalog.ColumnSchema.integer;
import static db.tpch.catalog.ColumnSchema.varchar;

import java.util.List;

/**
 * The TPC-H benchmark schema: eight tables and ten secondary indexes.
 *
 * <p>Column names, widths and nullability follow the dbgen output column layout so that
 * generated files load without renaming. Tables are declared referenced-before-referencing.
 */
public final class TpchSchema {
    public static final String REGION = "region";
    public static final String NATION = "nation";
    public static final String PART = "part";
    public static final String SUPPLIER = "supplier";
    public static final String PARTSUPP = "partsupp";
    public static final String CUSTOMER = "customer";
    public static final String ORDERS = "orders";
    public static final String LINEITEM = "lineitem";

    public static final String SCHEMA_NAME = "tpch";

    // Fixed-point currency columns
    private static final int MONEY_PRECISION = 15;
    private static final int MONEY_SCALE = 2;

    private TpchSchema() {}

    public static List<TableSchema> tables() {
        return List.of(region(), nation(), part(), supplier(), partsupp(), customer(), orders(), lineitem());
    }

    public static List<IndexSchema> indexes() {
        return List.of(
            new IndexSchema("idx_nation_regionkey", NATION, List.of("n_regionkey")),
            new IndexSchema("idx_supplier_nationkey", SUPPLIER, List.of("s_nationkey")),
            new IndexSchema("idx_customer_nationkey", CUSTOMER, List.of("c_nationkey")),
            new IndexSchema("idx_orders_custkey", ORDERS, List.of("o_custkey")),
            new IndexSchema("idx_orders_orderdate", ORDERS, List.of("o_orderdate")),
            new IndexSchema("idx_lineitem_orderkey", LINEITEM, List.of("l_orderkey")),
            new IndexSchema("idx_lineitem_partkey", LINEITEM, List.of("l_partkey")),
            new IndexSchema("idx_lineitem_suppkey", LINEITEM, List.of("l_suppkey")),
            new IndexSchema("idx_lineitem_shipdate", LINEITEM, List.of("l_shipdate")),
            new IndexSchema("idx_partsupp_suppkey", PARTSUPP, List.of("ps_suppkey"))
        );
    }

    static TableSchema region() {
        return new TableSchema(REGION, List.of(
            integer("r_regionkey"),
            varchar("r_name", 25),
            varchar("r_comment", 152).asNullable()
        ), List.of("r_regionkey"), List.of());
    }

    static TableSchema nation() {
        return new TableSchema(NATION, List.of(
            integer("n_nationkey"),
            varchar("n_name", 25),
            integer("n_regionkey"),
            varchar("n_comment", 152).asNullable()
        ), List.of("n_nationkey"), List.of(
            fk(NATION, "n_regionkey", REGION, "r_regionkey")
        ));
    }

    static TableSchema part() {
        return new TableSchema(PART, List.of(
            bigint("p_partkey"),
            varchar("p_name", 55),
            varchar("p_mfgr", 25),
            varchar("p_brand", 10),
            varchar("p_type", 25),
            integer("p_size").asNonNegative(),
            varchar("p_container", 10),
            money("p_retailprice").asNonNegative(),
            varchar("p_comment", 23).asNullable()
        ), List.of("p_partkey"), List.of());
    }

    static TableSchema supplier() {
        return new TableSchema(SUPPLIER, List.of(
            bigint("s_suppkey"),
            varchar("s_name", 25),
            varchar("s_address", 40),
            integer("s_nationkey"),
            varchar("s_phone", 15),
            money("s_acctbal"),
            varchar("s_comment", 101).asNullable()
        ), List.of("s_suppkey"), List.of(
            fk(SUPPLIER, "s_nationkey", NATION, "n_nationkey")
        ));
    }

    static TableSchema partsupp() {
        return new TableSchema(PARTSUPP, List.of(
            bigint("ps_partkey"),
            bigint("ps_suppkey"),
            bigint("ps_availqty").asNonNegative(),
            money("ps_supplycost").asNonNegative(),
            varchar("ps_comment", 199).asNullable()
        ), List.of("ps_partkey", "ps_suppkey"), List.of(
            fk(PARTSUPP, "ps_partkey", PART, "p_partkey"),
            fk(PARTSUPP, "ps_suppkey", SUPPLIER, "s_suppkey")
        ));
    }

    static TableSchema customer() {
        return new TableSchema(CUSTOMER, List.of(
            bigint("c_custkey"),
            varchar("c_name", 25),
            varchar("c_address", 40),
            integer("c_nationkey"),
            varchar("c_phone", 15),
            money("c_acctbal"),
            varchar("c_mktsegment", 10),
            varchar("c_comment", 117).asNullable()
        ), List.of("c_custkey"), List.of(
            fk(CUSTOMER, "c_nationkey", NATION, "n_nationkey")
        ));
    }

    static TableSchema orders() {
        return new TableSchema(ORDERS, List.of(
            bigint("o_orderkey"),
            bigint("o_custkey"),
            varchar("o_orderstatus", 1).oneOf("F", "O", "P"),
            money("o_totalprice").asNonNegative(),
            date("o_orderdate"),
            varchar("o_orderpriority", 15),
            varchar("o_clerk", 15),
            integer("o_shippriority").asNonNegative(),
            varchar("o_comment", 79).asNullable()
        ), List.of("o_orderkey"), List.of(
            fk(ORDERS, "o_custkey", CUSTOMER, "c_custkey")
        ));
    }

    static TableSchema lineitem() {
        return new TableSchema(LINEITEM, List.of(
            bigint("l_orderkey"),
            bigint("l_partkey"),
            bigint("l_suppkey"),
            bigint("l_linenumber").asNonNegative(),
            money("l_quantity").asNonNegative(),
            money("l_extendedprice").asNonNegative(),
            money("l_discount").asNonNegative(),
            money("l_tax").asNonNegative(),
            varchar("l_returnflag", 1).oneOf("A", "N", "R"),
            varchar("l_linestatus", 1).oneOf("F", "O"),
            date("l_shipdate"),
            date("l_commitdate"),
            date("l_receiptdate"),
            varchar("l_shipinstruct", 25),
            varchar("l_shipmode", 10),
            varchar("l_comment", 44).asNullable()
        ), List.of("l_orderkey", "l_linenumber"), List.of(
            fk(LINEITEM, "l_orderkey", ORDERS, "o_orderkey"),
            new ForeignKey(LINEITEM, List.of("l_partkey", "l_suppkey"), PARTSUPP, List.of("ps_partkey", "ps_suppkey"))
        ));
    }

    private static ColumnSchema money(String name) {
        return decimal(name, MONEY_PRECISION, MONEY_SCALE);
    }

    private static ForeignKey fk(String table, String column, String targetTable, String targetColumn) {
        return new ForeignKey(table, List.of(column), targetTable, List.of(targetColumn));
    }
}
