package com.poststudio.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * 以 code 字符串落库的枚举映射基类，库中的未知取值直接报错。
 */
public abstract class AbstractCodeEnumTypeHandler<E extends Enum<E>> extends BaseTypeHandler<E> {

    protected abstract String toCode(E value);

    protected abstract E fromCode(String code);

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, E parameter, JdbcType jdbcType) throws SQLException {
        ps.setString(i, toCode(parameter));
    }

    @Override
    public E getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return decode(rs.getString(columnName));
    }

    @Override
    public E getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return decode(rs.getString(columnIndex));
    }

    @Override
    public E getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return decode(cs.getString(columnIndex));
    }

    private E decode(String code) throws SQLException {
        if (code == null) {
            return null;
        }
        try {
            return fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Unknown enum code: " + code, ex);
        }
    }
}
