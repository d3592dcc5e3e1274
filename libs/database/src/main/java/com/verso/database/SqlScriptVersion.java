package com.verso.database;

import com.verso.versioner.ChangeException;
import com.verso.versioner.RollbackUnsupportedException;
import com.verso.versioner.Version;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.datasource.init.ScriptException;
import org.springframework.jdbc.datasource.init.ScriptUtils;

/**
 * Version whose upgrade and rollback are SQL script resources.
 *
 * <p>Scripts are split into statements and executed by Spring's {@link ScriptUtils} (statements
 * separated by {@code ;}, {@code --} comments). A version without a rollback script cannot be rolled
 * back.
 */
public class SqlScriptVersion implements Version {

    private final int number;
    private final String description;
    private final Resource upgradeScript;
    private final Resource rollbackScript;
    private final ConnectionSource connections;

    /**
     * @param number version number
     * @param description human-readable summary, used in logs
     * @param upgradeScript forward script
     * @param rollbackScript inverse script, or null when the change is irreversible
     * @param connections where to run the scripts
     */
    public SqlScriptVersion(
            int number,
            String description,
            Resource upgradeScript,
            Resource rollbackScript,
            ConnectionSource connections) {
        if (upgradeScript == null) {
            throw new IllegalArgumentException("upgradeScript must not be null");
        }
        if (connections == null) {
            throw new IllegalArgumentException("connections must not be null");
        }
        this.number = number;
        this.description = description == null ? "" : description;
        this.upgradeScript = upgradeScript;
        this.rollbackScript = rollbackScript;
        this.connections = connections;
    }

    @Override
    public int number() {
        return number;
    }

    @Override
    public void upgrade() {
        execute(upgradeScript, "upgrade");
    }

    @Override
    public void rollback() {
        if (rollbackScript == null) {
            throw new RollbackUnsupportedException(number);
        }
        execute(rollbackScript, "rollback");
    }

    private void execute(Resource script, String kind) {
        try {
            connections.withConnection(
                    connection -> {
                        ScriptUtils.executeSqlScript(
                                connection, new EncodedResource(script, StandardCharsets.UTF_8));
                        return null;
                    });
        } catch (SQLException | ScriptException e) {
            throw new ChangeException(
                    number,
                    kind
                            + " script "
                            + script.getDescription()
                            + " of version "
                            + number
                            + " failed",
                    e);
        }
    }

    public String description() {
        return description;
    }

    public boolean isReversible() {
        return rollbackScript != null;
    }

    @Override
    public String toString() {
        return "V" + number + " (" + description + ")";
    }
}
