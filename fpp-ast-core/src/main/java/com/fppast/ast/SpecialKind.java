package com.fppast.ast;

/**
 * Kind of a special port instance
 */
public enum SpecialKind implements WireEnum {
    COMMAND_RECV("CommandRecv", "command recv"),
    COMMAND_REG("CommandReg", "command reg"),
    COMMAND_RESP("CommandResp", "command resp"),
    EVENT("Event", "event"),
    PARAM_GET("ParamGet", "param get"),
    PARAM_SET("ParamSet", "param set"),
    PRODUCT_GET("ProductGet", "product get"),
    PRODUCT_RECV("ProductRecv", "product recv"),
    PRODUCT_REQUEST("ProductRequest", "product request"),
    PRODUCT_SEND("ProductSend", "product send"),
    TELEMETRY("Telemetry", "telemetry"),
    TEXT_EVENT("TextEvent", "text event"),
    TIME_GET("TimeGet", "time get");

    private final String tag;
    private final String text;

    SpecialKind(String tag, String text) {
        this.tag = tag;
        this.text = text;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return text;
    }
}
