package com.feedbackengine.common.model;

public enum AssetType {
    CRYPTO,
    FOREX,
    STOCKS
}
