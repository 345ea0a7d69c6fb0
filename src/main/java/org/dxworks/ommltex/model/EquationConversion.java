package org.dxworks.ommltex.model;

public class EquationConversion {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_PARSE_ERROR = "parse_error";
    public static final String STATUS_CONVERSION_ERROR = "conversion_error";

    public String kind = "equation";
    public String filePath;
    public String latex;
    public String status;

    public EquationConversion() {
    }

    public EquationConversion(String filePath, String latex, String status) {
        this.filePath = filePath;
        this.latex = latex;
        this.status = status;
    }
}
