package com.querybridge.cursor;

import java.sql.SQLException;

public interface CursorFactory {

    /**
     * Open a new cursor against a registered database. Each call returns a handle distinct
     * from any cursor currently executing.
     *
     * @param databaseId registered database id
     * @return new cursor; the caller closes it
     * @throws SQLException if no connection can be obtained
     */
    CursorHandle newCursor(String databaseId) throws SQLException;
}
