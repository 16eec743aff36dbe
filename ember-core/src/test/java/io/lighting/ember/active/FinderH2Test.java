package io.lighting.ember.active;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.ember.db.DefaultDb;
import io.lighting.ember.db.SqlLog;
import io.lighting.ember.jdbc.JdbcExecutor;
import io.lighting.ember.meta.Column;
import io.lighting.ember.meta.Id;
import io.lighting.ember.meta.OrderBy;
import io.lighting.ember.meta.Table;
import io.lighting.ember.meta.Unique;
import io.lighting.ember.query.Query;
import io.lighting.ember.query.QueryBuilder;
import io.lighting.ember.query.Scalar;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FinderH2Test {
    private final List<String> logged = new ArrayList<>();
    private DataSource source;
    private Finder<Member> members;
    private Finder<Seat> seats;

    @Table(name = "members")
    static class Member {
        @Id
        @OrderBy(priority = 1)
        Long id;

        @Column(name = "member_name")
        @Unique("name_club")
        @OrderBy
        String name;

        @Unique("name_club")
        String club;

        @Column
        int age;

        Member() {
        }

        Member(Long id, String name, String club, int age) {
            this.id = id;
            this.name = name;
            this.club = club;
            this.age = age;
        }
    }

    @Table(name = "seats")
    record Seat(
        @Id @Column(name = "seat_row") @OrderBy int row,
        @Id @OrderBy(priority = 1) int place,
        @Column Double price
    ) {
    }

    @Table(name = "holidays")
    static class Holiday {
        @Id
        long id;

        @Unique("day")
        LocalDate day;
    }

    @BeforeEach
    void setUp() throws SQLException {
        DataSource dataSource = dataSource();
        source = dataSource;
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE members (id BIGINT PRIMARY KEY, member_name VARCHAR(64), "
                + "club VARCHAR(64), age INT)");
            statement.execute("CREATE TABLE seats (seat_row INT, place INT, price DOUBLE, "
                + "PRIMARY KEY (seat_row, place))");
            statement.execute("INSERT INTO members VALUES (1, 'Ann', 'Chess', 31), (2, 'Bob', 'Chess', 17), "
                + "(3, 'Cid', 'Golf', 45), (4, 'Ann', 'Golf', NULL)");
            statement.execute("INSERT INTO seats VALUES (1, 2, 10.5), (1, 1, 12.0), (2, 1, NULL)");
        }
        SqlLog sqlLog = SqlLog.builder().prefix("TEST:").sink(logged::add).build();
        ActiveRecordConfig config = ActiveRecordConfig.builder()
            .db(new DefaultDb(new JdbcExecutor(dataSource), List.of(sqlLog)))
            .build();
        members = Finder.of(config, Member.class);
        seats = Finder.of(config, Seat.class);
    }

    @Test
    void loadsAllRowsInDefaultOrder() throws SQLException {
        List<Member> all = members.load();

        assertEquals(List.of(1L, 4L, 2L, 3L), all.stream().map(member -> member.id).toList());
        assertEquals("Chess", all.get(0).club);
        assertEquals(0, all.get(1).age);
        assertEquals(
            "TEST: [QUERY] SELECT id, member_name, club, age FROM members ORDER BY member_name, id | binds=[]",
            logged.get(0)
        );
    }

    @Test
    void queriesWithBuilder() throws SQLException {
        Query query = QueryBuilder.create()
            .col("age").ge(null)
            .and("club").eq(Scalar.of("Chess"))
            .order("age DESC")
            .build()
            .orElseThrow();
        query.setValue(1, Scalar.of(18));

        List<Member> adults = members.query(query);

        assertEquals(1, adults.size());
        assertEquals("Ann", adults.get(0).name);
    }

    @Test
    void pagesThroughRows() throws SQLException {
        Query page = QueryBuilder.create().order("id").limit(2).offset(1).build().orElseThrow();

        assertEquals(List.of(2L, 3L), members.query(page).stream().map(member -> member.id).toList());
    }

    @Test
    void findsByPrimaryKey() throws SQLException {
        assertEquals("Cid", members.find(3L).orElseThrow().name);
        assertTrue(members.find(99).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> members.find(1, 2));
        assertThrows(IllegalArgumentException.class, () -> members.find());
    }

    @Test
    void findsRecordByCompositeKey() throws SQLException {
        Seat seat = seats.find(1, 2).orElseThrow();

        assertEquals(new Seat(1, 2, 10.5), seat);
        assertEquals(new Seat(2, 1, null), seats.find(2, 1).orElseThrow());
        assertEquals(List.of(new Seat(1, 1, 12.0), new Seat(1, 2, 10.5), new Seat(2, 1, null)), seats.load());
    }

    @Test
    void findsByUniqueGroup() throws SQLException {
        assertEquals(4L, members.findBy("name_club", "Ann", "Golf").orElseThrow().id);
        assertTrue(members.findBy("name_club", "Ann", "Tennis").isEmpty());
        assertTrue(members.findBy("name_club", "Ann", null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> members.findBy("nope", "x"));
    }

    @Test
    void findsEqualModel() throws SQLException {
        Member probe = new Member(2L, "Zed", "Golf", 0);

        assertEquals("Bob", members.findEqual(probe).orElseThrow().name);
        assertTrue(members.findEqual(probe, "name_club").isEmpty());
        assertTrue(members.findEqual(new Member(null, "x", "y", 0)).isEmpty());
        assertEquals(new Seat(2, 1, null), seats.findEqual(new Seat(2, 1, 99.0)).orElseThrow());
    }

    @Test
    void validatesExistence() throws SQLException {
        assertDoesNotThrow(() -> members.validateExists(1L));

        ModelException error = assertThrows(ModelException.class, () -> members.validateExists(42L));
        assertEquals("members--not-found", error.code());
    }

    @Test
    void validatesUniqueness() throws SQLException {
        assertDoesNotThrow(() -> members.validateUnique(new Member(9L, "Bob", "Golf", 20)));

        ModelException error = assertThrows(
            ModelException.class,
            () -> members.validateUnique(new Member(9L, "Bob", "Chess", 20))
        );
        assertEquals("member_name--club--not-unique", error.code());
    }

    @Test
    void lookupsRunThroughQueryBuilder() throws SQLException {
        members.find(1L);

        assertEquals(
            "TEST: [QUERY] SELECT id, member_name, club, age FROM members WHERE id = ? | binds=[1]",
            logged.get(logged.size() - 1)
        );
    }

    @Test
    void ambiguousUniqueLookupFindsNothing() throws SQLException {
        try (Connection connection = source.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute("INSERT INTO members VALUES (5, 'Bob', 'Chess', 70)");
        }

        assertTrue(members.findBy("name_club", "Bob", "Chess").isEmpty());
        assertEquals(List.of(1L, 2L, 5L), members.query(
            QueryBuilder.create().col("club").eq(Scalar.of("Chess")).order("id").build().orElseThrow()
        ).stream().map(member -> member.id).toList());
    }

    @Test
    void rejectsModelWithUnsupportedKeyType() {
        ActiveRecordConfig config = ActiveRecordConfig.builder()
            .db(new DefaultDb(new JdbcExecutor(source)))
            .build();

        IllegalArgumentException error =
            assertThrows(IllegalArgumentException.class, () -> Finder.of(config, Holiday.class));
        assertEquals(
            "Key column holidays.day has unsupported type java.time.LocalDate; "
                + "use an integer, floating point or string type",
            error.getMessage()
        );
    }

    private static DataSource dataSource() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:finder_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        return dataSource;
    }
}
