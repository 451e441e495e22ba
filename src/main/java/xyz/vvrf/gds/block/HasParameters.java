package xyz.vvrf.gds.block;

import java.util.List;

/**
 * 声明参数依赖的 Block。引用只按名称，解析留给注册表。
 */
public interface HasParameters {

    List<String> getParamsUsed();
}
