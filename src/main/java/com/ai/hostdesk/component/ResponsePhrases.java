package com.ai.hostdesk.component;

import org.springframework.stereotype.Component;

/**
 * Every text the host desk sends. Kept in one place so flows stay free of wording.
 */
@Component
public class ResponsePhrases {

    public String waiterPasswordPrompt() {
        return "Please enter the waiter password.";
    }

    public String waiterAuthenticated() {
        return "Waiter authenticated. Please enter the table number that is now free (e.g., T4 or just 4).";
    }

    public String incorrectPassword() {
        return "Incorrect password. Please try again or say 'hi' to start as a customer.";
    }

    public String tableFreed(String tableNumber) {
        return "Table " + tableNumber + " marked as free. Attempting to seat waiting customers...";
    }

    public String invalidTableFormat() {
        return "Invalid table number format. Please enter just the number, e.g., '4' or 'Table 4'.";
    }

    public String unknownTable(String tableNumber) {
        return "Could not find table " + tableNumber + ". Please ensure the table number is correct (e.g., T1, T5, T10).";
    }

    public String namePeoplePrompt() {
        return "Enter your name and how many people are there (e.g., John, 5)";
    }

    public String namePeopleFormat() {
        return "Please provide name and number in format: Name, Number (e.g., John, 5)";
    }

    public String partySizeNotPositive() {
        return "Number of people must be a positive integer. Please try again.";
    }

    public String partyTooLarge(int maxCapacity) {
        return "We currently don't have tables for more than " + maxCapacity + " people. Please try with a smaller group.";
    }

    public String queued(String name, int partySize) {
        return "Got it! " + name + " with " + partySize + " people. You are in the queue. We will notify you when a table is ready.";
    }

    public String tableReady(String name, String tableNumber) {
        return "Great news, " + name + "! Your table " + tableNumber + " is ready. Please proceed to your table.";
    }

    public String help() {
        return "Please say 'hi' to start as a customer or 'waiter' to access waiter functions.";
    }

    public String textOnly() {
        return "I can only process text messages. Please say 'hi' to start.";
    }

    public String enqueueFailed() {
        return "There was an issue adding you to the queue. Please try again.";
    }

    public String somethingWentWrong() {
        return "Sorry, something went wrong on our side. Please send that again.";
    }
}
