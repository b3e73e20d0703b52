package io.intellixity.querygate.jdbc;

import javax.sql.DataSource;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.sql.*;
import java.util.*;

/** Proxy-backed JDBC fakes recording what the adapter asked the driver to do. */
final class FakeJdbc {
  final List<String> calls = Collections.synchronizedList(new ArrayList<>());
  final Map<Integer, Object> binds = new TreeMap<>();
  final List<String> columns;
  final List<List<Object>> rows;
  SQLException failWith;
  String preparedSql;

  FakeJdbc(List<String> columns, List<List<Object>> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  DataSource dataSource() {
    return proxy(DataSource.class, (p, m, a) -> switch (m.getName()) {
      case "getConnection" -> connection();
      default -> unsupported(m.getName());
    });
  }

  private Connection connection() {
    return proxy(Connection.class, (p, m, a) -> {
      calls.add(m.getName() + (a != null && a.length == 1 && !(a[0] instanceof String) ? "(" + a[0] + ")" : ""));
      return switch (m.getName()) {
        case "setReadOnly", "setAutoCommit", "rollback", "close" -> null;
        case "prepareStatement" -> {
          preparedSql = (String) a[0];
          yield statement();
        }
        default -> unsupported(m.getName());
      };
    });
  }

  private PreparedStatement statement() {
    return proxy(PreparedStatement.class, (p, m, a) -> switch (m.getName()) {
      case "setObject" -> {
        binds.put((Integer) a[0], a[1]);
        yield null;
      }
      case "setQueryTimeout", "setMaxRows" -> {
        calls.add(m.getName() + "(" + a[0] + ")");
        yield null;
      }
      case "cancel", "close" -> {
        calls.add(m.getName());
        yield null;
      }
      case "executeQuery" -> {
        if (failWith != null) throw failWith;
        yield resultSet();
      }
      default -> unsupported(m.getName());
    });
  }

  private ResultSet resultSet() {
    int[] cursor = {-1};
    ResultSetMetaData md = proxy(ResultSetMetaData.class, (p, m, a) -> switch (m.getName()) {
      case "getColumnCount" -> columns.size();
      case "getColumnLabel" -> columns.get((Integer) a[0] - 1);
      default -> unsupported(m.getName());
    });
    return proxy(ResultSet.class, (p, m, a) -> switch (m.getName()) {
      case "getMetaData" -> md;
      case "next" -> ++cursor[0] < rows.size();
      case "getObject" -> rows.get(cursor[0]).get((Integer) a[0] - 1);
      case "close" -> null;
      default -> unsupported(m.getName());
    });
  }

  private static Object unsupported(String name) {
    throw new UnsupportedOperationException(name);
  }

  @SuppressWarnings("unchecked")
  private static <T> T proxy(Class<T> type, InvocationHandler h) {
    return (T) Proxy.newProxyInstance(FakeJdbc.class.getClassLoader(), new Class<?>[]{type}, (p, m, a) -> {
      if (m.getDeclaringClass() == Object.class) {
        return switch (m.getName()) {
          case "hashCode" -> System.identityHashCode(p);
          case "equals" -> p == a[0];
          default -> type.getSimpleName() + "@fake";
        };
      }
      return h.invoke(p, m, a);
    });
  }
}
