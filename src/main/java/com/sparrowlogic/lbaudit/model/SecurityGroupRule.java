package com.sparrowlogic.lbaudit.model;

public record SecurityGroupRule(
    String groupId,
    String protocol,
    int fromPort,
    int toPort,
    String source
) {
    public boolean isOpenToWorld() {
        return "0.0.0.0/0".equals(source) || "::/0".equals(source);
    }

    /**
     * Port range as shown in reports. Rules for every protocol ({@code -1}) or without
     * ports, such as ICMP, read as {@code all}.
     */
    public String portRange() {
        if ("-1".equals(protocol) || fromPort < 0 || toPort < 0) {
            return "all";
        }
        return fromPort == toPort ? String.valueOf(fromPort) : fromPort + "-" + toPort;
    }

    public boolean coversOnlyWebPorts() {
        return (fromPort == 80 && toPort == 80) || (fromPort == 443 && toPort == 443);
    }
}
