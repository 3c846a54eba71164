package me.go_gradually.liveavatar.domain.avatar;

import java.util.LinkedHashMap;
import java.util.Map;

public record PhotoScene(double zoom,
                         double positionX,
                         double positionY,
                         double rotationX,
                         double rotationY,
                         double rotationZ,
                         double amplitude) {

    public static PhotoScene defaults() {
        return new PhotoScene(100, 0, 0, 0, 0, 0, 100);
    }

    // 퍼센트, 도 단위를 서비스 단위(비율, 라디안)로 바꾼다.
    public Map<String, Object> toServiceScene() {
        Map<String, Object> scene = new LinkedHashMap<>();
        scene.put("zoom", zoom / 100);
        scene.put("position_x", positionX / 100);
        scene.put("position_y", positionY / 100);
        scene.put("rotation_x", Math.toRadians(rotationX));
        scene.put("rotation_y", Math.toRadians(rotationY));
        scene.put("rotation_z", Math.toRadians(rotationZ));
        scene.put("amplitude", amplitude / 100);
        return scene;
    }
}
