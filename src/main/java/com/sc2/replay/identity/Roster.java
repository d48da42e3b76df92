package com.sc2.replay.identity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sc2.replay.model.Attribute;

import lombok.NonNull;

/**
 * Owns every team and person of one replay. Teams are keyed by number, people by pid.
 *
 * Not thread-safe: the replay decoder populating a roster must serialize its writes.
 */
public class Roster {
    private static final Logger log = LoggerFactory.getLogger(Roster.class);

    private final Map<Integer, Team> teams = new TreeMap<>();
    private final Map<Integer, Person> people = new LinkedHashMap<>();
    private final List<Attribute> gameAttributes = new ArrayList<>();

    public Player addPlayer(int pid, String name) {
        Player player = new Player(pid, name);
        register(player);
        return player;
    }

    public Observer addObserver(int pid, String name) {
        Observer observer = new Observer(pid, name);
        register(observer);
        return observer;
    }

    private void register(Person person) {
        if (people.containsKey(person.getPid())) {
            throw new IllegalArgumentException("Duplicate pid " + person.getPid() + ": " + person.getName());
        }
        people.put(person.getPid(), person);
        log.debug("Registered {}", person);
    }

    /**
     * The team with this number, created empty on first use.
     */
    public Team team(int number) {
        return teams.computeIfAbsent(number, Team::new);
    }

    public Optional<Team> findTeam(int number) {
        return Optional.ofNullable(teams.get(number));
    }

    /**
     * Put a player of this roster on a team, moving it off its previous team.
     */
    public Team assign(@NonNull Player player, int teamNumber) {
        if (people.get(player.getPid()) != player) {
            throw new IllegalArgumentException("Player " + player.getPid() + " does not belong to this roster");
        }
        Team team = team(teamNumber);
        team.addPlayer(player);
        return team;
    }

    public Optional<Person> findPerson(int pid) {
        return Optional.ofNullable(people.get(pid));
    }

    public Optional<Player> findPlayer(int pid) {
        Person person = people.get(pid);
        return person instanceof Player player ? Optional.of(player) : Optional.empty();
    }

    public Collection<Person> getPeople() {
        return Collections.unmodifiableCollection(people.values());
    }

    public List<Player> getPlayers() {
        return people.values().stream()
                .filter(Player.class::isInstance)
                .map(Player.class::cast)
                .toList();
    }

    public List<Observer> getObservers() {
        return people.values().stream()
                .filter(Observer.class::isInstance)
                .map(Observer.class::cast)
                .toList();
    }

    public List<Team> getTeams() {
        return List.copyOf(teams.values());
    }

    /**
     * Flag the person who recorded the replay. At most one person is the recorder.
     */
    public void markRecorder(int pid) {
        Person recorder = findPerson(pid)
                .orElseThrow(() -> new IllegalArgumentException("No person with pid " + pid));
        people.values().forEach(p -> p.setRecorder(p == recorder));
    }

    public Optional<Person> getRecorder() {
        return people.values().stream().filter(Person::isRecorder).findFirst();
    }

    /**
     * Copy the details-block entry onto a player. A known result is written to the player's
     * team, so the player must already be assigned when the result is a win or a loss.
     * Nothing is changed when that precondition fails.
     *
     * @throws IllegalStateException if the result is known but the player has no team
     */
    public void applyDetails(@NonNull Player player, @NonNull PlayerDetails details, @NonNull String region) {
        TeamResult result = TeamResult.fromCode(details.getResult());
        if (result != TeamResult.UNKNOWN && !player.hasTeam()) {
            throw new IllegalStateException("Player " + player.getPid() + " (" + player.getName()
                    + ") has no team to record the result " + result + " on");
        }
        if (details.getHandicap() < 0 || details.getHandicap() > 100) {
            throw new IllegalArgumentException("Handicap must be within 0..100: " + details.getHandicap());
        }
        if (details.getName() == null) {
            throw new IllegalArgumentException("Player details for pid " + player.getPid() + " have no name");
        }

        player.setName(details.getName());
        player.setRegion(region);
        if (details.getBnet() != null) {
            player.setSubregion(details.getBnet().getSubregion());
            player.setBnetUid(details.getBnet().getUid());
        }
        if (details.getRace() != null) {
            player.setPlayRace(details.getRace());
        }
        player.setColor(details.getColor());
        player.setHandicap(details.getHandicap());

        if (result != TeamResult.UNKNOWN) {
            player.getTeam().setResult(result);
        }
    }

    /**
     * Attributes whose owner is not a person of this roster, such as game-wide settings.
     */
    public List<Attribute> getGameAttributes() {
        return Collections.unmodifiableList(gameAttributes);
    }

    void addGameAttribute(Attribute attribute) {
        gameAttributes.add(attribute);
    }
}
