package xyz.vvrf.gds.exception;

/**
 * 框架内所有领域错误的基类（非受检）。
 * 错误总是在检测到问题的操作中同步抛出，不会重试。
 *
 * @author ruifeng.wen
 */
public class GdsException extends RuntimeException {

    public GdsException(String message) {
        super(message);
    }

    public GdsException(String message, Throwable cause) {
        super(message, cause);
    }
}
