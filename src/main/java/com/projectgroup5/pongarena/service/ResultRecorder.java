package com.projectgroup5.pongarena.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.pongarena.dao.MatchResultRepository;
import com.projectgroup5.pongarena.entity.MatchRecord;
import com.projectgroup5.pongarena.entity.TournamentRecord;
import com.projectgroup5.pongarena.game.GameResult;
import com.projectgroup5.pongarena.tournament.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 结果写库：JSON 在调用线程生成，写库放到 resultExecutor
 * 失败只记日志，不影响内存中的对局 / 锦标赛状态
 */
@Service
public class ResultRecorder {
    private static final Logger logger = LoggerFactory.getLogger(ResultRecorder.class);

    private final MatchResultRepository repository;
    private final ObjectMapper objectMapper;
    private final Executor resultExecutor;
    private final Clock clock;

    public ResultRecorder(MatchResultRepository repository,
                          ObjectMapper objectMapper,
                          @Qualifier("resultExecutor") Executor resultExecutor,
                          Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.resultExecutor = resultExecutor;
        this.clock = clock;
    }

    public void recordMatch(GameResult result) {
        Map<String, Object> players = new LinkedHashMap<>();
        players.put("player1", Map.of("id", result.player1Id(), "score", result.player1Score()));
        players.put("player2", Map.of("id", result.player2Id(), "score", result.player2Score()));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("winnerId", result.winnerId());
        meta.put("status", result.phase().wireName());
        meta.put("reason", result.endReason());
        meta.put("origin", result.origin().name());

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("players", players);
        root.put("metadata", meta);

        Instant endedAt = result.endedAt() != null ? result.endedAt() : clock.instant();
        Instant startedAt = result.startedAt() != null ? result.startedAt() : endedAt;

        MatchRecord record = new MatchRecord();
        record.setGameId(result.gameId());
        record.setOrigin(result.origin().name());
        record.setStartedAt(startedAt.toEpochMilli());
        record.setEndedAt(endedAt.toEpochMilli());
        try {
            record.setResultJson(objectMapper.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize result of game {}", result.gameId(), e);
            return;
        }
        submit("game " + result.gameId(), () -> repository.insertMatch(record));
    }

    /**
     * 调用方需持有该锦标赛的锁
     */
    public void recordTournament(Tournament tournament, List<Map<String, Object>> standings) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("participants", List.copyOf(tournament.getParticipants()));
        root.put("maxPlayers", tournament.getMaxPlayers());
        root.put("bracketType", tournament.getBracketType());
        root.put("rounds", tournament.getRounds().size());
        root.put("standings", standings);

        TournamentRecord record = new TournamentRecord();
        record.setTournamentId(tournament.getId());
        record.setName(tournament.getName());
        record.setWinnerId(tournament.getWinnerId());
        record.setCompletedAt(clock.millis());
        try {
            record.setResultJson(objectMapper.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize result of tournament {}", tournament.getId(), e);
            return;
        }
        submit("tournament " + tournament.getId(), () -> repository.insertTournament(record));
    }

    private void submit(String what, Runnable write) {
        try {
            resultExecutor.execute(() -> {
                try {
                    write.run();
                    logger.info("Result saved for {}", what);
                } catch (DataAccessException e) {
                    logger.error("Failed to save result for {}", what, e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.error("Result writer unavailable, dropping result for {}", what, e);
        }
    }
}
