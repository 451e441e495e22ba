package xyz.vvrf.gds.exception;

/**
 * 角色或组合代数不变量被破坏，
 * 例如带反向端口的 Mechanism、带逆变连线的 TemporalLoop。
 */
public class CompositionException extends GdsException {

    public CompositionException(String message) {
        super(message);
    }
}
