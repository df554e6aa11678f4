package com.projectgroup5.pongarena.dao;

import com.projectgroup5.pongarena.entity.MatchRecord;
import com.projectgroup5.pongarena.entity.TournamentRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class MatchResultRepository {

    private final JdbcTemplate jdbcTemplate;

    public MatchResultRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertMatch(MatchRecord record) {
        String sql = "INSERT INTO match_results (game_id, origin, started_at, ended_at, result_json) " +
                     "VALUES (?, ?, ?, ?, ?)";
        jdbcTemplate.update(sql,
                record.getGameId(),
                record.getOrigin(),
                record.getStartedAt(),
                record.getEndedAt(),
                record.getResultJson()
        );
    }

    public void insertTournament(TournamentRecord record) {
        String sql = "INSERT INTO tournament_results (tournament_id, name, winner_id, completed_at, result_json) " +
                     "VALUES (?, ?, ?, ?, ?)";
        jdbcTemplate.update(sql,
                record.getTournamentId(),
                record.getName(),
                record.getWinnerId(),
                record.getCompletedAt(),
                record.getResultJson()
        );
    }

    public List<MatchRecord> findMatchesByGameId(long gameId) {
        String sql = "SELECT id, game_id, origin, started_at, ended_at, result_json " +
                     "FROM match_results WHERE game_id = ?";
        return jdbcTemplate.query(sql, new MatchRecordRowMapper(), gameId);
    }

    public List<TournamentRecord> findTournamentResults(long tournamentId) {
        String sql = "SELECT id, tournament_id, name, winner_id, completed_at, result_json " +
                     "FROM tournament_results WHERE tournament_id = ?";
        return jdbcTemplate.query(sql, new TournamentRecordRowMapper(), tournamentId);
    }

    private static class MatchRecordRowMapper implements RowMapper<MatchRecord> {
        @Override
        public MatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            MatchRecord record = new MatchRecord();
            record.setId(rs.getLong("id"));
            record.setGameId(rs.getLong("game_id"));
            record.setOrigin(rs.getString("origin"));
            record.setStartedAt(rs.getLong("started_at"));
            record.setEndedAt(rs.getLong("ended_at"));
            record.setResultJson(rs.getString("result_json"));
            return record;
        }
    }

    private static class TournamentRecordRowMapper implements RowMapper<TournamentRecord> {
        @Override
        public TournamentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            TournamentRecord record = new TournamentRecord();
            record.setId(rs.getLong("id"));
            record.setTournamentId(rs.getLong("tournament_id"));
            record.setName(rs.getString("name"));
            long winnerId = rs.getLong("winner_id");
            record.setWinnerId(rs.wasNull() ? null : winnerId);
            record.setCompletedAt(rs.getLong("completed_at"));
            record.setResultJson(rs.getString("result_json"));
            return record;
        }
    }
}
