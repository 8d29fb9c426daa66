package by.radioegor146.cobfuscator.analysis;

/**
 * The four C identifier namespaces. Spellings in different namespaces never collide.
 */
public enum NameSpace {
    ORDINARY,
    TAG,
    LABEL,
    MEMBER
}
