package db.tpch.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class DdlRendererTest {
    private final DdlRenderer renderer = new DdlRenderer("tpch");

    private static String squash(String ddl) {
        return ddl.replaceAll("[ \\t]+", " ");
    }

    @Test
    void rendersTablesWithInlineKeys() {
        String ddl = squash(renderer.render(CatalogManager.tpch()));
        assertTrue(ddl.startsWith("CREATE SCHEMA IF NOT EXISTS tpch;\nSET search_path TO tpch;\n"));
        assertTrue(ddl.contains("CREATE TABLE region (\n r_regionkey INTEGER NOT NULL PRIMARY KEY,\n r_name VARCHAR(25) NOT NULL,\n r_comment VARCHAR(152)\n);"));
        assertTrue(ddl.contains(" n_regionkey INTEGER NOT NULL REFERENCES region(r_regionkey),"));
        assertTrue(ddl.contains(" o_totalprice DECIMAL(15,2) NOT NULL,"));
    }

    @Test
    void compositeKeysUseTableLevelClauses() {
        String ddl = squash(renderer.createTable(TpchSchema.lineitem()));
        assertTrue(ddl.contains(" PRIMARY KEY (l_orderkey, l_linenumber),"));
        assertTrue(ddl.contains(" FOREIGN KEY (l_orderkey) REFERENCES orders(o_orderkey),"));
        assertTrue(ddl.contains(" FOREIGN KEY (l_partkey, l_suppkey) REFERENCES partsupp(ps_partkey, ps_suppkey)\n);"));
        assertFalse(ddl.contains("l_orderkey BIGINT NOT NULL PRIMARY KEY"));
    }

    @Test
    void indexesAndForeignKeyStatements() {
        CatalogManager catalog = CatalogManager.tpch();
        assertEquals("CREATE INDEX IF NOT EXISTS idx_lineitem_shipdate ON tpch.lineitem(l_shipdate);",
            renderer.createIndex(catalog.getIndexSchema("idx_lineitem_shipdate"), true));

        List<String> fks = renderer.foreignKeyStatements(catalog);
        assertEquals(8, fks.size());
        assertEquals("ALTER TABLE tpch.nation ADD FOREIGN KEY (n_regionkey) REFERENCES tpch.region(r_regionkey);", fks.get(0));
        assertEquals("ALTER TABLE tpch.lineitem ADD FOREIGN KEY (l_partkey, l_suppkey) REFERENCES tpch.partsupp(ps_partkey, ps_suppkey);",
            fks.get(7));
    }
}
