package com.example.kbassist.model;

/** Well-known keys of {@link Fragment#getMetadata()}. */
public final class FragmentMetadata {

    public static final String SOURCE_DOCUMENT = "source_document";
    public static final String PAGE = "page";
    /** 0-based word offset of the fragment's first word inside its source page. */
    public static final String START_OFFSET = "start_offset";
    public static final String KNOWLEDGE_BASE_ID = "knowledge_base_id";

    private FragmentMetadata() {}
}
