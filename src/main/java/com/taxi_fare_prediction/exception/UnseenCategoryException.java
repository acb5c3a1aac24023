package com.taxi_fare_prediction.exception;

public class UnseenCategoryException extends RuntimeException {

    private final String column;
    private final String token;

    public UnseenCategoryException(String column, String token) {
        super("Category '" + token + "' of column " + column + " was not seen during training");
        this.column = column;
        this.token = token;
    }

    public String getColumn() {
        return column;
    }

    public String getToken() {
        return token;
    }
}
