package com.ringai.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.time.LocalTime;
import java.time.OffsetTime;

/**
 * PostgreSQL TIME / TIMETZ 到 LocalTime 的映射处理器，用于规则的生效时间窗。
 */
@MappedTypes(LocalTime.class)
public class CompatibleLocalTimeTypeHandler extends BaseTypeHandler<LocalTime> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, LocalTime parameter, JdbcType jdbcType) throws SQLException {
        ps.setObject(i, parameter);
    }

    @Override
    public LocalTime getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toLocalTime(rs.getObject(columnName));
    }

    @Override
    public LocalTime getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toLocalTime(rs.getObject(columnIndex));
    }

    @Override
    public LocalTime getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toLocalTime(cs.getObject(columnIndex));
    }

    private LocalTime toLocalTime(Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalTime localTime) {
            return localTime;
        }
        if (value instanceof Time time) {
            return time.toLocalTime();
        }
        if (value instanceof OffsetTime offsetTime) {
            return offsetTime.toLocalTime();
        }
        if (value instanceof String text) {
            return LocalTime.parse(text);
        }
        throw new SQLException("Unsupported time value type: " + value.getClass().getName());
    }
}
