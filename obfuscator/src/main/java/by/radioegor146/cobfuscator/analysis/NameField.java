package by.radioegor146.cobfuscator.analysis;

/**
 * The node field a recorded identifier occurrence is stored in.
 */
public enum NameField {
    DECL_NAME,
    TYPE_DECLNAME,
    TYPEDEF_NAME,
    AGGREGATE_NAME,
    ENUM_NAME,
    ENUMERATOR_NAME,
    ID_NAME,
    LABEL_NAME,
    GOTO_NAME,
    /**
     * One word of an {@code IdentifierType}; the location carries the word index.
     */
    TYPE_NAMES
}
