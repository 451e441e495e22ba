package xyz.vvrf.gds.block;

import java.util.List;

/**
 * 携带约束注释 (纯文本) 的 Block。
 */
public interface HasConstraints {

    List<String> getConstraints();
}
