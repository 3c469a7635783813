package gamefleet.hub.service;

import gamefleet.core.ErrorKind;
import gamefleet.core.FleetException;
import gamefleet.hub.store.Database;
import gamefleet.hub.store.JdbcUserRepository;
import gamefleet.security.AuthException;
import gamefleet.security.AuthFailure;
import gamefleet.security.AuthFailureThrottle;
import gamefleet.security.AuthGate;
import gamefleet.security.DashboardTokenService;
import gamefleet.security.PasswordHasher;
import gamefleet.security.Principal;
import gamefleet.security.Role;
import gamefleet.security.SecurityAudit;
import gamefleet.testing.MutableClock;
import gamefleet.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AccountServiceTest {

    private static final String ORIGIN = "203.0.113.9";

    private Database db;
    private MutableClock clock;
    private AuthGate gate;
    private AccountService accounts;
    private Principal admin;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create("accounts");
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        DashboardTokenService tokens = new DashboardTokenService("account-test-secret-123", Duration.ofHours(1), clock);
        gate = new AuthGate(tokens, id -> Optional.empty(), new AuthFailureThrottle(3, Duration.ofMinutes(5), 100, clock),
                new SecurityAudit(), clock, Duration.ofMinutes(5), null);
        accounts = new AccountService(new JdbcUserRepository(db), new PasswordHasher(1_000), gate, clock);
        accounts.bootstrapAdmin("admin", "initial-password");
        admin = gate.authenticateDashboard(accounts.login("admin", "initial-password", ORIGIN).accessToken(), ORIGIN);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void bootstrapOnlyRunsOnEmptyStore() {
        assertEquals(Optional.empty(), accounts.bootstrapAdmin("admin2", null));
        assertEquals(1, accounts.listUsers().size());
        assertEquals(Role.ADMIN, admin.role());
    }

    @Test
    void generatedBootstrapPasswordWorks() {
        Database other = TestDatabases.create("accounts-bootstrap");
        try {
            AccountService fresh = new AccountService(new JdbcUserRepository(other), new PasswordHasher(1_000), gate, clock);
            String generated = fresh.bootstrapAdmin("root", null).orElseThrow();
            assertEquals(Role.ADMIN, fresh.login("root", generated, ORIGIN).role());
        } finally {
            other.close();
        }
    }

    @Test
    void wrongPasswordAndUnknownUserLookAlike() {
        AuthException wrong = assertThrows(AuthException.class, () -> accounts.login("admin", "nope", ORIGIN));
        AuthException unknown = assertThrows(AuthException.class, () -> accounts.login("ghost", "nope", "198.51.100.1"));
        assertEquals(wrong.failure(), unknown.failure());
        assertEquals(wrong.getMessage(), unknown.getMessage());
    }

    @Test
    void repeatedBadLoginsAreThrottled() {
        for (int i = 0; i < 3; i++) {
            assertThrows(AuthException.class, () -> accounts.login("admin", "nope", ORIGIN));
        }
        AuthException e = assertThrows(AuthException.class,
                () -> accounts.login("admin", "initial-password", ORIGIN));
        assertEquals(AuthFailure.THROTTLED, e.failure());
    }

    @Test
    void logoutRevokesTheToken() {
        String token = accounts.login("admin", "initial-password", ORIGIN).accessToken();
        Principal session = gate.authenticateDashboard(token, ORIGIN);
        accounts.logout(session);
        assertThrows(AuthException.class, () -> gate.authenticateDashboard(token, ORIGIN));
    }

    @Test
    void createAndDeleteUsers() {
        accounts.createUser("olga", "operator-pass", Role.OPERATOR, admin);
        assertEquals(Role.OPERATOR, accounts.login("olga", "operator-pass", ORIGIN).role());

        FleetException duplicate = assertThrows(FleetException.class,
                () -> accounts.createUser("olga", "another-pass", Role.VIEWER, admin));
        assertEquals(ErrorKind.CONFLICT, duplicate.kind());
        assertThrows(FleetException.class, () -> accounts.createUser("bad name", "long-enough", Role.VIEWER, admin));
        assertThrows(FleetException.class, () -> accounts.createUser("shorty", "short", Role.VIEWER, admin));

        accounts.deleteUser("olga", admin);
        assertThrows(AuthException.class, () -> accounts.login("olga", "operator-pass", "198.51.100.2"));
        assertEquals(ErrorKind.NOT_FOUND,
                assertThrows(FleetException.class, () -> accounts.deleteUser("olga", admin)).kind());
    }

    @Test
    void cannotDeleteSelfOrLastAdmin() {
        assertEquals(ErrorKind.CONFLICT,
                assertThrows(FleetException.class, () -> accounts.deleteUser("admin", admin)).kind());

        accounts.createUser("ada", "second-admin", Role.ADMIN, admin);
        Principal ada = new Principal("ada", Role.ADMIN, null);
        accounts.deleteUser("admin", ada);
        assertEquals(1, accounts.listUsers().size());
    }

    @Test
    void deletedUsersTokensStopWorking() {
        accounts.createUser("olga", "operator-pass", Role.OPERATOR, admin);
        String token = accounts.login("olga", "operator-pass", ORIGIN).accessToken();
        clock.advance(Duration.ofSeconds(2));

        accounts.deleteUser("olga", admin);
        assertThrows(AuthException.class, () -> gate.authenticateDashboard(token, ORIGIN));
    }

    @Test
    void changePasswordRotatesCredentialsAndTokens() {
        String otherSession = accounts.login("admin", "initial-password", ORIGIN).accessToken();
        clock.advance(Duration.ofSeconds(2));

        AccountService.LoginResult result =
                accounts.changePassword(admin, "initial-password", "brand-new-password", ORIGIN);

        assertEquals("admin", gate.authenticateDashboard(result.accessToken(), ORIGIN).name());
        assertThrows(AuthException.class, () -> gate.authenticateDashboard(otherSession, ORIGIN));
        assertThrows(AuthException.class, () -> accounts.login("admin", "initial-password", ORIGIN));
        assertEquals(Role.ADMIN, accounts.login("admin", "brand-new-password", ORIGIN).role());
    }

    @Test
    void changePasswordRequiresCurrentPassword() {
        AuthException e = assertThrows(AuthException.class,
                () -> accounts.changePassword(admin, "wrong", "brand-new-password", ORIGIN));
        assertEquals(AuthFailure.UNAUTHENTICATED, e.failure());
    }
}
