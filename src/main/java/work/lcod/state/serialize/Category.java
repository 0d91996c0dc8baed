package work.lcod.state.serialize;

/**
 * Rendering rule selected for a value. Declaration order is the classification order.
 */
public enum Category {
    NULL,
    BOOLEAN,
    QUOTED_SCALAR,
    NUMBER,
    STRING,
    SECURE_VALUE,
    CREDENTIAL,
    DATE_TIME,
    ENUMERATION,
    CODE_BLOCK,
    HANDLE,
    MARKUP,
    TABLE,
    ORDERED_MAP,
    VALUE_SCALAR,
    MAP,
    SEQUENCE,
    OBJECT
}
