package com.versionrace.core.repository;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the current row of a result set to a value.
 */
@FunctionalInterface
public interface RowReader<T> {

    T read(ResultSet rs) throws SQLException;
}
