package uk.gov.di.result.collections;

public enum CollectionError {
    IS_NULL,
    IS_EMPTY,
    NO_MATCHING_ITEMS,
    MULTIPLE_MATCHING_ITEMS
}
