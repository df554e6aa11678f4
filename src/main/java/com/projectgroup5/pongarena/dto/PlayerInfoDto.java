package com.projectgroup5.pongarena.dto;

public class PlayerInfoDto {
    private long id;
    private String name;
    private String avatar;
    private boolean ai;

    public PlayerInfoDto() {
    }

    public PlayerInfoDto(long id, String name, String avatar, boolean ai) {
        this.id = id;
        this.name = name;
        this.avatar = avatar;
        this.ai = ai;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAvatar() {
        return avatar;
    }

    public void setAvatar(String avatar) {
        this.avatar = avatar;
    }

    public boolean isAi() {
        return ai;
    }

    public void setAi(boolean ai) {
        this.ai = ai;
    }
}
