/* (C)2026 */
package com.ammann.captionbox.enumeration;

/**
 * The 26 box features in feature-vector order.
 *
 * <p>Groups: spatial (1-7), user annotations (8-9), edge positions (10-13),
 * character sets (14-24) and temporal position (25-26).
 */
public enum FeatureName {
    TOP_ALIGNMENT("topAlignment"),
    BOTTOM_ALIGNMENT("bottomAlignment"),
    HEIGHT_SIMILARITY("heightSimilarity"),
    HORIZONTAL_CLUSTERING("horizontalClustering"),
    ASPECT_RATIO("aspectRatio"),
    NORMALIZED_Y("normalizedY"),
    NORMALIZED_AREA("normalizedArea"),
    IS_USER_ANNOTATED_IN("isUserAnnotatedIn"),
    IS_USER_ANNOTATED_OUT("isUserAnnotatedOut"),
    NORMALIZED_LEFT("normalizedLeft"),
    NORMALIZED_TOP("normalizedTop"),
    NORMALIZED_RIGHT("normalizedRight"),
    NORMALIZED_BOTTOM("normalizedBottom"),
    IS_ROMAN("isRoman"),
    IS_HANZI("isHanzi"),
    IS_ARABIC("isArabic"),
    IS_KOREAN("isKorean"),
    IS_HIRAGANA("isHiragana"),
    IS_KATAKANA("isKatakana"),
    IS_CYRILLIC("isCyrillic"),
    IS_DEVANAGARI("isDevanagari"),
    IS_THAI("isThai"),
    IS_DIGITS("isDigits"),
    IS_PUNCTUATION("isPunctuation"),
    TIME_FROM_START("timeFromStart"),
    TIME_FROM_END("timeFromEnd");

    /** Number of features in every feature vector. */
    public static final int COUNT = 26;

    private final String displayName;

    FeatureName(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static FeatureName ofIndex(int index) {
        return values()[index];
    }
}
