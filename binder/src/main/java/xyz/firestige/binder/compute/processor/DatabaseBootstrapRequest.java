package xyz.firestige.binder.compute.processor;

import java.util.ArrayList;
import java.util.List;

/**
 * 数据库初始化请求，{@link #statements()} 给出可重复执行的 SQL
 */
public final class DatabaseBootstrapRequest {

    private final String host;
    private final int port;
    private final String rootUser;
    private final String rootPassword;
    private final String database;
    private final String user;
    private final String password;
    private final String initSql;

    public DatabaseBootstrapRequest(String host, int port, String rootUser, String rootPassword,
                                    String database, String user, String password, String initSql) {
        this.host = host;
        this.port = port;
        this.rootUser = rootUser;
        this.rootPassword = rootPassword;
        this.database = database;
        this.user = user;
        this.password = password;
        this.initSql = initSql;
    }

    public List<String> statements() {
        List<String> sql = new ArrayList<>();
        sql.add("DO $$ BEGIN "
                + "IF NOT EXISTS (SELECT FROM pg_roles WHERE rolname = " + literal(user) + ") THEN "
                + "CREATE ROLE " + ident(user) + " LOGIN PASSWORD " + literal(password) + "; "
                + "ELSE ALTER ROLE " + ident(user) + " WITH LOGIN PASSWORD " + literal(password) + "; "
                + "END IF; END $$");
        sql.add("SELECT 'CREATE DATABASE " + ident(database).replace("'", "''") + " OWNER "
                + ident(user).replace("'", "''") + "' WHERE NOT EXISTS "
                + "(SELECT FROM pg_database WHERE datname = " + literal(database) + ")");
        sql.add("GRANT ALL PRIVILEGES ON DATABASE " + ident(database) + " TO " + ident(user));
        if (initSql != null && !initSql.isBlank()) {
            sql.add(initSql);
        }
        return sql;
    }

    private static String ident(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    private static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getRootUser() {
        return rootUser;
    }

    public String getRootPassword() {
        return rootPassword;
    }

    public String getDatabase() {
        return database;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getInitSql() {
        return initSql;
    }

    @Override
    public String toString() {
        return "DatabaseBootstrapRequest{" + user + "@" + host + ":" + port + "/" + database + '}';
    }
}
