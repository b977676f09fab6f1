package com.stockpipe.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

/**
 * Centralized MyBatis bootstrap. Sessions run on connections handed out by
 * {@link com.stockpipe.db.Database}, so transactions stay under the caller's control.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);

        config.addMapper(PriceMapper.class);
        config.addMapper(NewsMapper.class);
        config.addMapper(LabelMapper.class);
        config.addMapper(RunLogMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
