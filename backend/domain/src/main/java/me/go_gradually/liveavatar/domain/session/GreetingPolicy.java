package me.go_gradually.liveavatar.domain.session;

public enum GreetingPolicy {
    NONE,
    IMMEDIATE,
    DEFERRED_UNTIL_AVATAR_CONNECT;

    public static GreetingPolicy resolve(SessionConfig config) {
        if (config == null || !config.proactiveGreeting()) {
            return NONE;
        }
        if (!config.avatarEnabled()) {
            return IMMEDIATE;
        }
        // WebRTC 아바타는 SDP 응답이 브라우저에 전달된 뒤에 인사해야 첫 발화가 영상에 실린다.
        return config.avatarOutputMode().isPeerToPeer() ? DEFERRED_UNTIL_AVATAR_CONNECT : IMMEDIATE;
    }
}
