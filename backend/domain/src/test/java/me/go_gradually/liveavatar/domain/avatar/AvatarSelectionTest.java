package me.go_gradually.liveavatar.domain.avatar;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AvatarSelectionTest {

    @Test
    void standard_splitsCharacterAndStyle() {
        AvatarSelection avatar = AvatarSelection.standard("Lisa-casual-sitting", "", AvatarOutputMode.WEBRTC);

        assertEquals("lisa", avatar.character());
        assertEquals("casual-sitting", avatar.style());
        assertNull(avatar.backgroundImageUrl());
        assertEquals(List.of(560, 0), avatar.cropTopLeft());
        assertEquals(List.of(1360, 1080), avatar.cropBottomRight());
    }

    @Test
    void photo_usesDefaultNameAndNoCrop() {
        AvatarSelection avatar = AvatarSelection.photo(null, null, AvatarOutputMode.WEBSOCKET, PhotoScene.defaults());

        assertEquals("anika", avatar.character());
        assertNull(avatar.style());
        assertTrue(avatar.isPhoto());
        assertNull(avatar.cropTopLeft());
    }

    @Test
    void custom_keepsNameAsIs() {
        AvatarSelection avatar = AvatarSelection.custom("MyBrandAvatar", null, null);

        assertEquals("MyBrandAvatar", avatar.character());
        assertTrue(avatar.isCustomized());
        assertEquals(AvatarOutputMode.WEBRTC, avatar.outputMode());
    }

    @Test
    void photoScene_convertsToServiceUnits() {
        Map<String, Object> scene = new PhotoScene(120, 10, -20, 0, 180, 0, 50).toServiceScene();

        assertEquals(1.2, scene.get("zoom"));
        assertEquals(0.1, scene.get("position_x"));
        assertEquals(-0.2, scene.get("position_y"));
        assertEquals(Math.PI, (double) scene.get("rotation_y"), 1e-9);
        assertEquals(0.5, scene.get("amplitude"));
    }
}
