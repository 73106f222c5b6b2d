package com.enumerant.core;

/**
 * Reads the tag roles the member cache cares about while it is being built.
 */
public interface TagInspector {

    /**
     * @return the text carried by {@code tag} if it is a preferred textual tag, null otherwise
     */
    String preferredText(Object tag);

    /**
     * @return the serialized name carried by {@code tag} if it is a member-value tag, null otherwise
     */
    String memberValueText(Object tag);

    boolean isPrimaryMarker(Object tag);

    /**
     * Recognizes {@link Description}, {@link MemberValue} and {@link Primary}.
     */
    TagInspector DEFAULT = new TagInspector() {
        @Override
        public String preferredText(Object tag) {
            return tag instanceof Description ? ((Description) tag).getText() : null;
        }

        @Override
        public String memberValueText(Object tag) {
            return tag instanceof MemberValue ? ((MemberValue) tag).getValue() : null;
        }

        @Override
        public boolean isPrimaryMarker(Object tag) {
            return tag instanceof Primary;
        }
    };
}
