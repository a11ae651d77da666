package com.netlink.osp.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.netlink.osp.network.Cable;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.PonPort;
import com.netlink.osp.network.Port;
import com.netlink.osp.network.Splitter;
import com.netlink.osp.network.Tray;
import com.netlink.osp.splice.Splice;

import lombok.Data;

/** JSON snapshot of a whole project. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ProjectDefinition {
    public static final String FORMAT_VERSION = "1";

    private String name;
    private String version = FORMAT_VERSION;
    private List<NetworkElement> elements = new ArrayList<>();
    private List<Cable> cables = new ArrayList<>();
    private List<Tray> trays = new ArrayList<>();
    private List<Splitter> splitters = new ArrayList<>();
    private List<Port> ports = new ArrayList<>();
    private List<PonPort> ponPorts = new ArrayList<>();
    private List<Splice> splices = new ArrayList<>();
}
