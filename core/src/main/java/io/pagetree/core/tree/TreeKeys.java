package io.pagetree.core.tree;

/** Field names and literals of the stored tree format. */
public final class TreeKeys {

    public static final String ROOT = "root";
    public static final String ID = "id";
    public static final String DATA = "data";
    public static final String TYPE = "type";
    public static final String PROPERTIES = "properties";
    public static final String CHILDREN = "children";
    public static final String PARENT_ID = "_parentId";
    /** Accepted on input when {@link #PARENT_ID} is absent. */
    public static final String PARENT_ID_ALIAS = "parentId";
    public static final String NEXT_NODE_ID = "_nextNodeId";
    public static final String LOOKUP_TABLE = "exportedLookupTable";
    public static final String STATUS = "status";

    public static final String STATUS_EXPORTED = "exported";
    public static final String ROOT_TYPE = "root";
    public static final String EMPTY_ROOT_ID = "el-root";

    private TreeKeys() {}
}
