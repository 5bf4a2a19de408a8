package com.vfxport.tree;

/**
 * Classification of a keyed top-level entry by its declared type name.
 */
public enum BlockKind {
    SYSTEM("VfxSystemDefinitionData"),
    MATERIAL("StaticMaterialDef"),
    RESOURCE_RESOLVER("ResourceResolver"),
    SKIN_DATA("SkinCharacterDataProperties"),
    OTHER(null),
    FIELD(null),
    UNKEYED(null);

    private final String typeName;

    BlockKind(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public static BlockKind fromTypeName(String typeName) {
        if (typeName == null) {
            return OTHER;
        }
        for (BlockKind kind : values()) {
            if (typeName.equals(kind.typeName)) {
                return kind;
            }
        }
        return OTHER;
    }
}
