package com.taxi_fare_prediction.enumeration;

/**
 * What the one-hot encoder does with a categorical token that never appeared in the training data.
 * <ul>
 *   <li>UNKNOWN_BUCKET: every categorical column reserves an extra "__unknown__" indicator. Unseen tokens
 *       light that indicator and leave all known indicators at 0.</li>
 *   <li>ERROR: no reserved indicator. An unseen token aborts the run.</li>
 * </ul>
 */
public enum UnseenCategoryPolicyEnum {
    UNKNOWN_BUCKET,
    ERROR
}
