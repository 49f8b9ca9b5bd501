package net.spotter.adapter.jdbc.repo;

import net.spotter.adapter.jdbc.JdbcUtil;
import net.spotter.adapter.jdbc.TxContext;
import net.spotter.adapter.jdbc.mapper.RowMappers;
import net.spotter.core.model.Account;
import net.spotter.core.spi.AccountStore;
import net.spotter.core.spi.TxRunner;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/** TB_ACCOUNT. 상태/쿨다운/마지막 위치만 저장하고 자격 증명은 두지 않는다 */
public final class JdbcAccountStore implements AccountStore {
    private final TxRunner tx;

    public JdbcAccountStore(TxRunner tx) { this.tx = tx; }

    @Override
    public List<Account> loadAccounts() throws Exception {
        return tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_ACCOUNT ORDER BY USERNAME");
                 var rs = ps.executeQuery()) {
                List<Account> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toAccount(rs));
                return out;
            }
        });
    }

    @Override
    public void saveAccount(Account a) throws Exception {
        var sql = """
            MERGE INTO TB_ACCOUNT d
            USING (SELECT CAST(? AS VARCHAR(100)) USERNAME FROM DUAL) s
               ON (d.USERNAME = s.USERNAME)
            WHEN MATCHED THEN UPDATE SET
                 PROVIDER       = ?,
                 STATE          = ?,
                 COOLDOWN_UNTIL = ?,
                 LAST_USED      = ?,
                 CHALLENGES     = ?,
                 LAST_LAT       = ?,
                 LAST_LON       = ?,
                 UPDATED_AT     = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN INSERT
                 (USERNAME, PROVIDER, STATE, COOLDOWN_UNTIL, LAST_USED, CHALLENGES, LAST_LAT, LAST_LON, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            """;
        tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement(sql)) {
                int i = 1;
                ps.setString(i++, a.username());
                i = bindState(ps, i, a);
                ps.setString(i++, a.username());
                bindState(ps, i, a);
                return ps.executeUpdate();
            }
        });
    }

    private static int bindState(PreparedStatement ps, int i, Account a) throws SQLException {
        ps.setString(i++, a.provider());
        ps.setString(i++, a.state().code());
        ps.setTimestamp(i++, JdbcUtil.ts(a.cooldownUntil()));
        ps.setTimestamp(i++, JdbcUtil.ts(a.lastUsed()));
        ps.setInt(i++, a.challenges());
        if (a.lastPosition() == null) {
            ps.setNull(i++, Types.DOUBLE);
            ps.setNull(i++, Types.DOUBLE);
        } else {
            ps.setDouble(i++, a.lastPosition().lat());
            ps.setDouble(i++, a.lastPosition().lon());
        }
        return i;
    }
}
