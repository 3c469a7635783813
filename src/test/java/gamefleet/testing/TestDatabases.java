package gamefleet.testing;

import gamefleet.hub.store.Database;

/**
 * Fresh in-memory H2 databases in PostgreSQL mode.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static String url(String name) {
        return "jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static Database create(String name) {
        return new Database(url(name), 4);
    }
}
