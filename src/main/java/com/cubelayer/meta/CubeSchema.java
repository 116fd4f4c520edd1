package com.cubelayer.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * 单个声明文件的根节点
 */
public class CubeSchema {
    @JsonProperty("version")
    private String version;

    @JsonProperty("cubes")
    private List<CubeDeclaration> cubes;

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<CubeDeclaration> getCubes() {
        return cubes;
    }

    public void setCubes(List<CubeDeclaration> cubes) {
        this.cubes = cubes;
    }
}
