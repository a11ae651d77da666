package com.netlink.osp.network;

/** Canvas coordinates of an element. */
public record Position(double x, double y) {
}
