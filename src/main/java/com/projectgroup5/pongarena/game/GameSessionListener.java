package com.projectgroup5.pongarena.game;

/** 对局进入终态时回调，每个对局只调用一次 */
public interface GameSessionListener {

    void onSessionEnded(GameSession session);
}
