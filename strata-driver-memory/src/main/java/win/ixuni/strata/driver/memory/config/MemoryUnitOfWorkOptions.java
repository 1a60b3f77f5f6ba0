package win.ixuni.strata.driver.memory.config;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import win.ixuni.strata.core.config.UnitOfWorkOptions;

/**
 * Memory 驱动配置
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
public class MemoryUnitOfWorkOptions extends UnitOfWorkOptions {

    /**
     * 数据库名称，使用时附加部署环境限定
     */
    private final String databaseName;
}
