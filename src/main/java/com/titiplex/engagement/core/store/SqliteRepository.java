package com.titiplex.engagement.core.store;

import com.titiplex.engagement.core.model.BcState;
import com.titiplex.engagement.core.model.BonCommande;
import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.model.Contrat;
import com.titiplex.engagement.core.model.TodoItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Stockage SQLite. Une connexion est ouverte puis fermée pour chaque opération ;
 * {@link #inTransaction(Function)} lie une instance à une connexion unique le temps d'une transaction.
 */
@org.springframework.stereotype.Repository
public class SqliteRepository implements Repository {

    private static final Logger log = LoggerFactory.getLogger(SqliteRepository.class);

    private final String url;
    private final SQLiteConfig sqliteConfig;
    private final Connection bound;

    @Autowired
    public SqliteRepository(@Value("${app.data.dir}") String dataDir,
                            @Value("${app.db.file:budget_projet.db}") String dbFile,
                            @Value("${app.db.busy-timeout-ms:5000}") int busyTimeoutMs) {
        try {
            Files.createDirectories(Path.of(dataDir));
        } catch (IOException e) {
            throw new StoreException("Répertoire de données inaccessible: " + dataDir, e);
        }
        this.url = "jdbc:sqlite:" + Path.of(dataDir).resolve(dbFile);
        this.sqliteConfig = new SQLiteConfig();
        sqliteConfig.enforceForeignKeys(true);
        sqliteConfig.setBusyTimeout(busyTimeoutMs);
        // BEGIN IMMEDIATE : le verrou d'écriture est pris dès l'ouverture de la transaction
        sqliteConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.bound = null;
        init();
    }

    private SqliteRepository(SqliteRepository parent, Connection bound) {
        this.url = parent.url;
        this.sqliteConfig = parent.sqliteConfig;
        this.bound = bound;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    private Connection open() throws SQLException {
        return DriverManager.getConnection(url, sqliteConfig.toProperties());
    }

    private <T> T run(SqlWork<T> work) {
        if (bound != null) {
            try {
                return work.run(bound);
            } catch (SQLException e) {
                throw new StoreException(e);
            }
        }
        try (Connection c = open()) {
            return work.run(c);
        } catch (SQLException e) {
            throw new StoreException(e);
        }
    }

    @Override
    public <T> T inTransaction(Function<Repository, T> work) {
        if (bound != null) return work.apply(this);
        try (Connection c = open()) {
            c.setAutoCommit(false);
            try {
                T out = work.apply(new SqliteRepository(this, c));
                c.commit();
                return out;
            } catch (RuntimeException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException(e);
        }
    }

    @Override
    public void init() {
        run(c -> {
            try (Statement st = c.createStatement()) {
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS contrats (
                          id INTEGER PRIMARY KEY AUTOINCREMENT,
                          numero_contrat TEXT NOT NULL UNIQUE,
                          client_id INTEGER,
                          contact_id INTEGER,
                          date_debut TEXT,
                          date_fin TEXT,
                          montant TEXT DEFAULT '0',
                          description TEXT,
                          statut TEXT DEFAULT 'Actif' CHECK(statut IN ('Actif', 'Expiré', 'Résilié')),
                          alerte_6_mois INTEGER DEFAULT 0
                        )""");
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS budgets (
                          id INTEGER PRIMARY KEY AUTOINCREMENT,
                          client_id INTEGER NOT NULL,
                          annee INTEGER NOT NULL,
                          nature TEXT NOT NULL CHECK(nature IN ('Fonctionnement', 'Investissement')),
                          montant_initial TEXT NOT NULL DEFAULT '0',
                          montant_consomme TEXT NOT NULL DEFAULT '0',
                          montant_disponible TEXT NOT NULL DEFAULT '0',
                          service_demandeur TEXT,
                          UNIQUE(client_id, annee, nature)
                        )""");
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS bons_commande (
                          id INTEGER PRIMARY KEY AUTOINCREMENT,
                          numero_bc TEXT NOT NULL UNIQUE,
                          client_id INTEGER NOT NULL,
                          contrat_id INTEGER,
                          nature TEXT NOT NULL CHECK(nature IN ('Fonctionnement', 'Investissement')),
                          type TEXT NOT NULL CHECK(type IN ('Assistance', 'Formation', 'Prestation', 'Matériel', 'Licences')),
                          service_demandeur TEXT,
                          montant TEXT NOT NULL,
                          valide INTEGER DEFAULT 0,
                          date_validation TEXT,
                          description TEXT,
                          FOREIGN KEY (contrat_id) REFERENCES contrats(id) ON DELETE SET NULL
                        )""");
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS bc_sequences (
                          annee INTEGER PRIMARY KEY,
                          dernier INTEGER NOT NULL
                        )""");
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS todo_list (
                          id INTEGER PRIMARY KEY AUTOINCREMENT,
                          motif TEXT NOT NULL,
                          description TEXT,
                          contrat_id INTEGER,
                          date_echeance TEXT,
                          priorite TEXT DEFAULT 'Normale' CHECK(priorite IN ('Basse', 'Normale', 'Haute', 'Urgente')),
                          complete INTEGER DEFAULT 0,
                          date_completion TEXT,
                          FOREIGN KEY (contrat_id) REFERENCES contrats(id) ON DELETE SET NULL
                        )""");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_contrats_dates ON contrats(date_debut, date_fin)");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_budgets_client ON budgets(client_id)");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_budgets_annee ON budgets(annee)");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_bc_client ON bons_commande(client_id)");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_bc_valide ON bons_commande(valide)");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_todo_complete ON todo_list(complete)");
            }
            return null;
        });
        log.debug("Schéma initialisé ({})", url);
    }

    // ---------- Budgets ----------
    @Override
    public long insertBudget(Budget b) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO budgets(client_id,annee,nature,montant_initial,montant_consomme,montant_disponible,service_demandeur) " +
                            "VALUES(?,?,?,?,?,?,?)")) {
                ps.setLong(1, b.clientId());
                ps.setInt(2, b.annee());
                ps.setString(3, b.nature());
                ps.setString(4, b.montantInitial().toPlainString());
                ps.setString(5, b.montantConsomme().toPlainString());
                ps.setString(6, b.montantDisponible().toPlainString());
                ps.setString(7, b.serviceDemandeur());
                ps.executeUpdate();
            }
            return lastInsertId(c);
        });
    }

    @Override
    public void updateBudget(Budget b) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE budgets SET client_id=?, annee=?, nature=?, montant_initial=?, montant_consomme=?, " +
                            "montant_disponible=?, service_demandeur=? WHERE id=?")) {
                ps.setLong(1, b.clientId());
                ps.setInt(2, b.annee());
                ps.setString(3, b.nature());
                ps.setString(4, b.montantInitial().toPlainString());
                ps.setString(5, b.montantConsomme().toPlainString());
                ps.setString(6, b.montantDisponible().toPlainString());
                ps.setString(7, b.serviceDemandeur());
                ps.setLong(8, b.id());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void deleteBudget(long id) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM budgets WHERE id=?")) {
                ps.setLong(1, id);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Budget findBudget(long id) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM budgets WHERE id=?")) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapBudget(rs) : null;
                }
            }
        });
    }

    @Override
    public Budget findBudget(long clientId, int annee, String nature) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM budgets WHERE client_id=? AND annee=? AND nature=?")) {
                ps.setLong(1, clientId);
                ps.setInt(2, annee);
                ps.setString(3, nature);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapBudget(rs) : null;
                }
            }
        });
    }

    @Override
    public List<Budget> listBudgets(Integer annee, String nature) {
        StringBuilder sql = new StringBuilder("SELECT * FROM budgets WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (annee != null) {
            sql.append(" AND annee=?");
            params.add(annee);
        }
        if (nature != null) {
            sql.append(" AND nature=?");
            params.add(nature);
        }
        sql.append(" ORDER BY annee DESC, client_id ASC");
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                bind(ps, params);
                List<Budget> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(mapBudget(rs));
                }
                return out;
            }
        });
    }

    private Budget mapBudget(ResultSet rs) throws SQLException {
        return new Budget(
                rs.getLong("id"),
                rs.getLong("client_id"),
                rs.getInt("annee"),
                rs.getString("nature"),
                new BigDecimal(rs.getString("montant_initial")),
                new BigDecimal(rs.getString("montant_consomme")),
                new BigDecimal(rs.getString("montant_disponible")),
                rs.getString("service_demandeur")
        );
    }

    // ---------- Bons de commande ----------
    @Override
    public long insertBc(BonCommande bc) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO bons_commande(numero_bc,client_id,contrat_id,nature,type,service_demandeur,montant,valide,description) " +
                            "VALUES(?,?,?,?,?,?,?,?,?)")) {
                ps.setString(1, bc.numeroBc());
                ps.setLong(2, bc.clientId());
                setNullableLong(ps, 3, bc.contratId());
                ps.setString(4, bc.nature());
                ps.setString(5, bc.type());
                ps.setString(6, bc.serviceDemandeur());
                ps.setString(7, bc.montant().toPlainString());
                ps.setInt(8, BcState.DRAFT.valide());
                ps.setString(9, bc.description());
                ps.executeUpdate();
            }
            return lastInsertId(c);
        });
    }

    @Override
    public int updateBc(BonCommande bc) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE bons_commande SET client_id=?, contrat_id=?, nature=?, type=?, service_demandeur=?, " +
                            "montant=?, description=? WHERE id=? AND valide=0")) {
                ps.setLong(1, bc.clientId());
                setNullableLong(ps, 2, bc.contratId());
                ps.setString(3, bc.nature());
                ps.setString(4, bc.type());
                ps.setString(5, bc.serviceDemandeur());
                ps.setString(6, bc.montant().toPlainString());
                ps.setString(7, bc.description());
                ps.setLong(8, bc.id());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void markValidated(long id, LocalDateTime at) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE bons_commande SET valide=1, date_validation=? WHERE id=? AND valide=0")) {
                ps.setString(1, at.toString());
                ps.setLong(2, id);
                int n = ps.executeUpdate();
                if (n != 1) throw new SQLException("BC " + id + " absent ou déjà validé");
                return n;
            }
        });
    }

    @Override
    public int deleteBc(long id) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM bons_commande WHERE id=? AND valide=0")) {
                ps.setLong(1, id);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public BonCommande findBc(long id) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM bons_commande WHERE id=?")) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapBc(rs) : null;
                }
            }
        });
    }

    @Override
    public boolean existsNumeroBc(String numeroBc) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM bons_commande WHERE numero_bc=?")) {
                ps.setString(1, numeroBc);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public String maxNumeroBc(int annee) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT numero_bc FROM bons_commande WHERE numero_bc LIKE ? ORDER BY numero_bc DESC LIMIT 1")) {
                ps.setString(1, "BC-" + annee + "-%");
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getString(1) : null;
                }
            }
        });
    }

    @Override
    public int countValidatedBc(long clientId, String nature) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COUNT(*) FROM bons_commande WHERE client_id=? AND nature=? AND valide=1")) {
                ps.setLong(1, clientId);
                ps.setString(2, nature);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public int countBcForContrat(long contratId) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM bons_commande WHERE contrat_id=?")) {
                ps.setLong(1, contratId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public List<BonCommande> listBcs(BcState etat, String nature) {
        StringBuilder sql = new StringBuilder("SELECT * FROM bons_commande WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (etat != null) {
            sql.append(" AND valide=?");
            params.add(etat.valide());
        }
        if (nature != null) {
            sql.append(" AND nature=?");
            params.add(nature);
        }
        sql.append(" ORDER BY numero_bc DESC");
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                bind(ps, params);
                return collectBcs(ps);
            }
        });
    }

    @Override
    public List<BonCommande> listBcsForYear(int annee) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM bons_commande WHERE numero_bc LIKE ? ORDER BY numero_bc ASC")) {
                ps.setString(1, "BC-" + annee + "-%");
                return collectBcs(ps);
            }
        });
    }

    private List<BonCommande> collectBcs(PreparedStatement ps) throws SQLException {
        List<BonCommande> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(mapBc(rs));
        }
        return out;
    }

    private BonCommande mapBc(ResultSet rs) throws SQLException {
        String validation = rs.getString("date_validation");
        return new BonCommande(
                rs.getLong("id"),
                rs.getString("numero_bc"),
                rs.getLong("client_id"),
                nullableLong(rs, "contrat_id"),
                rs.getString("nature"),
                rs.getString("type"),
                rs.getString("service_demandeur"),
                new BigDecimal(rs.getString("montant")),
                BcState.fromValide(rs.getInt("valide")),
                validation == null ? null : LocalDateTime.parse(validation),
                rs.getString("description")
        );
    }

    // ---------- Séquences ----------
    @Override
    public int lastSequence(int annee) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT dernier FROM bc_sequences WHERE annee=?")) {
                ps.setInt(1, annee);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public void saveSequence(int annee, int dernier) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO bc_sequences(annee,dernier) VALUES(?,?) " +
                            "ON CONFLICT(annee) DO UPDATE SET dernier=excluded.dernier")) {
                ps.setInt(1, annee);
                ps.setInt(2, dernier);
                return ps.executeUpdate();
            }
        });
    }

    // ---------- Contrats ----------
    @Override
    public long insertContrat(Contrat ct) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO contrats(numero_contrat,client_id,contact_id,date_debut,date_fin,montant,description,statut,alerte_6_mois) " +
                            "VALUES(?,?,?,?,?,?,?,?,?)")) {
                bindContrat(ps, ct);
                ps.executeUpdate();
            }
            return lastInsertId(c);
        });
    }

    @Override
    public void updateContrat(Contrat ct) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE contrats SET numero_contrat=?, client_id=?, contact_id=?, date_debut=?, date_fin=?, " +
                            "montant=?, description=?, statut=?, alerte_6_mois=? WHERE id=?")) {
                bindContrat(ps, ct);
                ps.setLong(10, ct.id());
                return ps.executeUpdate();
            }
        });
    }

    private void bindContrat(PreparedStatement ps, Contrat ct) throws SQLException {
        ps.setString(1, ct.numeroContrat());
        setNullableLong(ps, 2, ct.clientId());
        setNullableLong(ps, 3, ct.contactId());
        ps.setString(4, ct.dateDebut() == null ? null : ct.dateDebut().toString());
        ps.setString(5, ct.dateFin() == null ? null : ct.dateFin().toString());
        ps.setString(6, ct.montant() == null ? "0" : ct.montant().toPlainString());
        ps.setString(7, ct.description());
        ps.setString(8, ct.statut());
        ps.setInt(9, ct.alerte6Mois() ? 1 : 0);
    }

    @Override
    public void deleteContrat(long id) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM contrats WHERE id=?")) {
                ps.setLong(1, id);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Contrat findContrat(long id) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM contrats WHERE id=?")) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapContrat(rs) : null;
                }
            }
        });
    }

    @Override
    public boolean existsNumeroContrat(String numeroContrat, Long excludeId) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT 1 FROM contrats WHERE numero_contrat=? AND id != ?")) {
                ps.setString(1, numeroContrat);
                ps.setLong(2, excludeId == null ? -1L : excludeId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public List<Contrat> listContrats(String statut, boolean alerteOnly) {
        StringBuilder sql = new StringBuilder("SELECT * FROM contrats WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (statut != null) {
            sql.append(" AND statut=?");
            params.add(statut);
        }
        if (alerteOnly) sql.append(" AND alerte_6_mois=1");
        sql.append(" ORDER BY date_fin ASC");
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                bind(ps, params);
                return collectContrats(ps);
            }
        });
    }

    @Override
    public List<Contrat> listActiveContratsWithEndDate() {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM contrats WHERE statut='Actif' AND date_fin IS NOT NULL ORDER BY date_fin ASC")) {
                return collectContrats(ps);
            }
        });
    }

    @Override
    public void updateAlerte(long contratId, boolean alerte) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE contrats SET alerte_6_mois=? WHERE id=?")) {
                ps.setInt(1, alerte ? 1 : 0);
                ps.setLong(2, contratId);
                return ps.executeUpdate();
            }
        });
    }

    private List<Contrat> collectContrats(PreparedStatement ps) throws SQLException {
        List<Contrat> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(mapContrat(rs));
        }
        return out;
    }

    private Contrat mapContrat(ResultSet rs) throws SQLException {
        String montant = rs.getString("montant");
        return new Contrat(
                rs.getLong("id"),
                rs.getString("numero_contrat"),
                nullableLong(rs, "client_id"),
                nullableLong(rs, "contact_id"),
                nullableDate(rs, "date_debut"),
                nullableDate(rs, "date_fin"),
                montant == null ? BigDecimal.ZERO : new BigDecimal(montant),
                rs.getString("description"),
                rs.getString("statut"),
                rs.getInt("alerte_6_mois") == 1
        );
    }

    // ---------- Todo ----------
    @Override
    public long insertTodo(TodoItem t) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO todo_list(motif,description,contrat_id,date_echeance,priorite,complete) VALUES(?,?,?,?,?,0)")) {
                ps.setString(1, t.motif());
                ps.setString(2, t.description());
                setNullableLong(ps, 3, t.contratId());
                ps.setString(4, t.dateEcheance() == null ? null : t.dateEcheance().toString());
                ps.setString(5, t.priorite());
                ps.executeUpdate();
            }
            return lastInsertId(c);
        });
    }

    @Override
    public void updateTodo(TodoItem t) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE todo_list SET motif=?, description=?, contrat_id=?, date_echeance=?, priorite=? WHERE id=?")) {
                ps.setString(1, t.motif());
                ps.setString(2, t.description());
                setNullableLong(ps, 3, t.contratId());
                ps.setString(4, t.dateEcheance() == null ? null : t.dateEcheance().toString());
                ps.setString(5, t.priorite());
                ps.setLong(6, t.id());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void setTodoComplete(long id, boolean complete, LocalDateTime at) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE todo_list SET complete=?, date_completion=? WHERE id=?")) {
                ps.setInt(1, complete ? 1 : 0);
                ps.setString(2, at == null ? null : at.toString());
                ps.setLong(3, id);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void deleteTodo(long id) {
        run(c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM todo_list WHERE id=?")) {
                ps.setLong(1, id);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public TodoItem findTodo(long id) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM todo_list WHERE id=?")) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapTodo(rs) : null;
                }
            }
        });
    }

    @Override
    public boolean existsOpenTodoForContrat(long contratId) {
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT 1 FROM todo_list WHERE contrat_id=? AND complete=0")) {
                ps.setLong(1, contratId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public List<TodoItem> listTodos(Boolean complete) {
        StringBuilder sql = new StringBuilder("SELECT * FROM todo_list WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (complete != null) {
            sql.append(" AND complete=?");
            params.add(complete ? 1 : 0);
        }
        sql.append(" ORDER BY CASE priorite WHEN 'Urgente' THEN 1 WHEN 'Haute' THEN 2 WHEN 'Normale' THEN 3 ELSE 4 END, date_echeance");
        return run(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                bind(ps, params);
                List<TodoItem> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(mapTodo(rs));
                }
                return out;
            }
        });
    }

    private TodoItem mapTodo(ResultSet rs) throws SQLException {
        String completion = rs.getString("date_completion");
        return new TodoItem(
                rs.getLong("id"),
                rs.getString("motif"),
                rs.getString("description"),
                nullableLong(rs, "contrat_id"),
                nullableDate(rs, "date_echeance"),
                rs.getString("priorite"),
                rs.getInt("complete") == 1,
                completion == null ? null : LocalDateTime.parse(completion)
        );
    }

    // ---------- helpers ----------
    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) ps.setObject(i + 1, params.get(i));
    }

    private static void setNullableLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null) ps.setNull(idx, Types.INTEGER);
        else ps.setLong(idx, value);
    }

    private static Long nullableLong(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : v;
    }

    private static LocalDate nullableDate(ResultSet rs, String col) throws SQLException {
        String v = rs.getString(col);
        return v == null || v.isBlank() ? null : LocalDate.parse(v);
    }
}
