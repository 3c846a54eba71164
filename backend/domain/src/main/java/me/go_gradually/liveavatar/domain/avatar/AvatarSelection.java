package me.go_gradually.liveavatar.domain.avatar;

import java.util.List;
import java.util.Locale;

public record AvatarSelection(AvatarKind kind,
                              String character,
                              String style,
                              String backgroundImageUrl,
                              AvatarOutputMode outputMode,
                              PhotoScene scene) {
    public static final String DEFAULT_AVATAR_NAME = "Lisa-casual-sitting";
    public static final String DEFAULT_PHOTO_AVATAR_NAME = "Anika";
    public static final String VIDEO_CODEC = "h264";
    public static final String PHOTO_AVATAR_TYPE = "photo-avatar";
    public static final String PHOTO_AVATAR_MODEL = "vasa-1";
    private static final List<Integer> CROP_TOP_LEFT = List.of(560, 0);
    private static final List<Integer> CROP_BOTTOM_RIGHT = List.of(1360, 1080);

    public AvatarSelection {
        if (kind == null) {
            throw new IllegalArgumentException("Avatar kind is required");
        }
        if (character == null || character.isBlank()) {
            throw new IllegalArgumentException("Avatar character is required");
        }
        if (outputMode == null) {
            outputMode = AvatarOutputMode.WEBRTC;
        }
        if (backgroundImageUrl != null && backgroundImageUrl.isBlank()) {
            backgroundImageUrl = null;
        }
    }

    public static AvatarSelection standard(String avatarName, String backgroundImageUrl, AvatarOutputMode outputMode) {
        String name = isBlank(avatarName) ? DEFAULT_AVATAR_NAME : avatarName;
        return new AvatarSelection(AvatarKind.STANDARD, characterOf(name), styleOf(name),
                backgroundImageUrl, outputMode, null);
    }

    public static AvatarSelection photo(String photoAvatarName,
                                        String backgroundImageUrl,
                                        AvatarOutputMode outputMode,
                                        PhotoScene scene) {
        String name = isBlank(photoAvatarName) ? DEFAULT_PHOTO_AVATAR_NAME : photoAvatarName;
        return new AvatarSelection(AvatarKind.PHOTO, characterOf(name), styleOf(name),
                backgroundImageUrl, outputMode, scene);
    }

    public static AvatarSelection custom(String customAvatarName, String backgroundImageUrl, AvatarOutputMode outputMode) {
        return new AvatarSelection(AvatarKind.CUSTOM, customAvatarName, null, backgroundImageUrl, outputMode, null);
    }

    public boolean isPhoto() {
        return kind == AvatarKind.PHOTO;
    }

    public boolean isCustomized() {
        return kind == AvatarKind.CUSTOM;
    }

    public boolean isPeerToPeer() {
        return outputMode.isPeerToPeer();
    }

    // 사진 아바타는 크롭 없이 원본 프레임을 사용한다.
    public List<Integer> cropTopLeft() {
        return isPhoto() ? null : CROP_TOP_LEFT;
    }

    public List<Integer> cropBottomRight() {
        return isPhoto() ? null : CROP_BOTTOM_RIGHT;
    }

    private static String characterOf(String name) {
        int separator = name.indexOf('-');
        String character = separator < 0 ? name : name.substring(0, separator);
        return character.toLowerCase(Locale.ROOT);
    }

    private static String styleOf(String name) {
        int separator = name.indexOf('-');
        return separator < 0 ? null : name.substring(separator + 1);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
