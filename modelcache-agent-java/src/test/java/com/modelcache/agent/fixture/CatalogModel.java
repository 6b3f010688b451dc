package com.modelcache.agent.fixture;

/**
 * Entity with load methods in the shape the agent instruments. Woven in tests only.
 */
public class CatalogModel {

    private Object loadedId;
    private int fetchLine;

    public CatalogModel load(Object id) {
        if ("missing".equals(id)) {
            throw new IllegalArgumentException("no entity " + id);
        }
        loadedId = id;
        return this;
    }

    public CatalogModel load(int id) {
        loadedId = id;
        return this;
    }

    /** Loads through one more caller frame and remembers the line that calls {@code load}. */
    public CatalogModel fetch(Object id) {
        fetchLine = new Throwable().getStackTrace()[0].getLineNumber(); return load(id);
    }

    public int getFetchLine() {
        return fetchLine;
    }

    public Object getLoadedId() {
        return loadedId;
    }
}
