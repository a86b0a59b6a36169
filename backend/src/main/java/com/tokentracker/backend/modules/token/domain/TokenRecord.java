package com.tokentracker.backend.modules.token.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.tokentracker.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One tracked service/shipment record. {@code amountDue} and {@code margin} are
 * derived from the other amounts and only written through {@link #recalculateAmounts()}
 * or the bulk payment updates.
 */
@Entity
@Table(name = "tokens")
public class TokenRecord extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "date")
    private LocalDate date;

    @Column(name = "completion_date")
    private LocalDate completionDate;

    @Column(name = "location", length = 50)
    private String location;

    @Column(name = "sub_location", length = 100)
    private String subLocation;

    @Column(name = "token", nullable = false, unique = true, length = 100)
    private String token;

    // client portal password for the shipment, not an account credential
    @Column(name = "password", length = 255)
    private String password;

    @Column(name = "client_name", length = 255)
    private String clientName;

    @Column(name = "contact", length = 255)
    private String contact;

    @Column(name = "who_will_ship", length = 255)
    private String whoWillShip;

    @Column(name = "contacted_client", length = 100)
    private String contactedClient;

    @Column(name = "status", length = 50)
    private String status;

    @Column(name = "forwarded", length = 50)
    private String forwarded;

    @Column(name = "charges", nullable = false, precision = 10, scale = 2)
    private BigDecimal charges = BigDecimal.ZERO;

    @Column(name = "payment_received", nullable = false, precision = 10, scale = 2)
    private BigDecimal paymentReceived = BigDecimal.ZERO;

    @Column(name = "amount_due", nullable = false, precision = 10, scale = 2)
    private BigDecimal amountDue = BigDecimal.ZERO;

    @Column(name = "charges_to_executive", nullable = false, precision = 10, scale = 2)
    private BigDecimal chargesToExecutive = BigDecimal.ZERO;

    @Column(name = "agent_name", length = 255)
    private String agentName;

    @Column(name = "executive_name", length = 255)
    private String executiveName;

    @Column(name = "margin", nullable = false, precision = 10, scale = 2)
    private BigDecimal margin = BigDecimal.ZERO;

    @Column(name = "process_by", length = 50)
    private String processBy;

    @Column(name = "agent_payment_applied", nullable = false)
    private boolean agentPaymentApplied;

    @Column(name = "executive_payment_applied", nullable = false)
    private boolean executivePaymentApplied;

    public void recalculateAmounts() {
        this.charges = TokenAmounts.orZero(charges);
        this.paymentReceived = TokenAmounts.orZero(paymentReceived);
        this.chargesToExecutive = TokenAmounts.orZero(chargesToExecutive);
        this.amountDue = TokenAmounts.amountDue(charges, paymentReceived);
        this.margin = TokenAmounts.margin(charges, chargesToExecutive);
    }

    public Long getId() {
        return id;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public LocalDate getCompletionDate() {
        return completionDate;
    }

    public void setCompletionDate(LocalDate completionDate) {
        this.completionDate = completionDate;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getSubLocation() {
        return subLocation;
    }

    public void setSubLocation(String subLocation) {
        this.subLocation = subLocation;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public String getContact() {
        return contact;
    }

    public void setContact(String contact) {
        this.contact = contact;
    }

    public String getWhoWillShip() {
        return whoWillShip;
    }

    public void setWhoWillShip(String whoWillShip) {
        this.whoWillShip = whoWillShip;
    }

    public String getContactedClient() {
        return contactedClient;
    }

    public void setContactedClient(String contactedClient) {
        this.contactedClient = contactedClient;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getForwarded() {
        return forwarded;
    }

    public void setForwarded(String forwarded) {
        this.forwarded = forwarded;
    }

    public BigDecimal getCharges() {
        return charges;
    }

    public void setCharges(BigDecimal charges) {
        this.charges = charges;
    }

    public BigDecimal getPaymentReceived() {
        return paymentReceived;
    }

    public void setPaymentReceived(BigDecimal paymentReceived) {
        this.paymentReceived = paymentReceived;
    }

    public BigDecimal getAmountDue() {
        return amountDue;
    }

    public BigDecimal getChargesToExecutive() {
        return chargesToExecutive;
    }

    public void setChargesToExecutive(BigDecimal chargesToExecutive) {
        this.chargesToExecutive = chargesToExecutive;
    }

    public String getAgentName() {
        return agentName;
    }

    public void setAgentName(String agentName) {
        this.agentName = agentName;
    }

    public String getExecutiveName() {
        return executiveName;
    }

    public void setExecutiveName(String executiveName) {
        this.executiveName = executiveName;
    }

    public BigDecimal getMargin() {
        return margin;
    }

    public String getProcessBy() {
        return processBy;
    }

    public void setProcessBy(String processBy) {
        this.processBy = processBy;
    }

    public boolean isAgentPaymentApplied() {
        return agentPaymentApplied;
    }

    public boolean isExecutivePaymentApplied() {
        return executivePaymentApplied;
    }
}
