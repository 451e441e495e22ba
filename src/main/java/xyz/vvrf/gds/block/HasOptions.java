package xyz.vvrf.gds.block;

import java.util.List;

/**
 * 列举命名策略选项的 Block。
 */
public interface HasOptions {

    List<String> getOptions();
}
