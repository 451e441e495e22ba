package xyz.vvrf.gds.exception;

/**
 * 组合时端口 token 不兼容。
 */
public class TypeMismatchException extends GdsException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
